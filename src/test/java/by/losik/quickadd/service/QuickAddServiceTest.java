package by.losik.quickadd.service;

import by.losik.quickadd.config.ParserConfig;
import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.parser.PatternDetector;
import by.losik.quickadd.parser.ResultFormatter;
import by.losik.quickadd.parser.TaskPipeline;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class QuickAddServiceTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    @Mock
    private TaskPipeline pipeline;

    @Mock
    private PatternDetector detector;

    @Mock
    private ResultFormatter formatter;

    private final Clock clock = Clock.fixed(Instant.parse("2024-01-01T10:00:00Z"), ZoneOffset.UTC);

    private QuickAddService service;

    @BeforeEach
    void setUp() {
        service = new QuickAddService(pipeline, detector, formatter, clock, new ParserConfig("UTC", true, true));
    }

    @Test
    void parse_ShouldPassClockInstantToPipeline() {
        ParsedTask parsed = ParsedTask.builder().text("Call mom").build();
        when(pipeline.parse(eq("Call mom tomorrow"), any(LocalDateTime.class))).thenReturn(parsed);

        ParsedTask result = service.parse("Call mom tomorrow");

        ArgumentCaptor<LocalDateTime> nowCaptor = ArgumentCaptor.forClass(LocalDateTime.class);
        verify(pipeline).parse(eq("Call mom tomorrow"), nowCaptor.capture());
        assertEquals(NOW, nowCaptor.getValue());
        assertSame(parsed, result);
    }

    @Test
    void parse_WithNull_ShouldThrow() {
        assertThrows(NullPointerException.class, () -> service.parse(null));
        verifyNoInteractions(pipeline);
    }

    @Test
    void looksParseable_ShouldDelegateToDetector() {
        when(detector.looksParseable("Buy milk")).thenReturn(false);

        assertFalse(service.looksParseable("Buy milk"));
    }

    @Test
    void formatForDisplay_ShouldUseSameClock() {
        ParsedTask parsed = ParsedTask.builder().text("t").build();
        when(formatter.format(parsed, NOW)).thenReturn(List.of("⚡ high priority"));

        assertEquals(List.of("⚡ high priority"), service.formatForDisplay(parsed));
    }

    @Test
    void preview_WithBlankText_ShouldSkipEverything() {
        assertTrue(service.preview("   ").isEmpty());
        assertTrue(service.preview(null).isEmpty());
        verifyNoInteractions(detector, pipeline);
    }

    @Test
    void preview_WhenDetectorRejects_ShouldNotParse() {
        when(detector.looksParseable("Buy milk")).thenReturn(false);

        assertTrue(service.preview("Buy milk").isEmpty());
        verify(pipeline, never()).parse(anyString(), any(LocalDateTime.class));
    }

    @Test
    void preview_WhenDetectorAccepts_ShouldParse() {
        ParsedTask parsed = ParsedTask.builder().text("Call mom").build();
        when(detector.looksParseable("Call mom tomorrow")).thenReturn(true);
        when(pipeline.parse("Call mom tomorrow", NOW)).thenReturn(parsed);

        assertEquals(Optional.of(parsed), service.preview("Call mom tomorrow"));
    }

    @Test
    void preview_WithGateDisabled_ShouldParseWithoutDetector() {
        QuickAddService ungated = new QuickAddService(pipeline, detector, formatter, clock,
                new ParserConfig("UTC", true, false));
        ParsedTask parsed = ParsedTask.builder().text("Buy milk").build();
        when(pipeline.parse("Buy milk", NOW)).thenReturn(parsed);

        assertEquals(Optional.of(parsed), ungated.preview("Buy milk"));
        verifyNoInteractions(detector);
    }

    @Test
    void parse_WithRealComponents_ShouldResolveAgainstClock() {
        QuickAddService real = new QuickAddService(new TaskPipeline(), new PatternDetector(), new ResultFormatter(),
                clock, new ParserConfig("UTC", true, true));

        ParsedTask parsed = real.parse("Call mom tomorrow at 5pm");

        assertEquals("Call mom", parsed.text());
        assertEquals(LocalDateTime.of(2024, 1, 2, 17, 0), parsed.dueDate());
        assertEquals(List.of("🔔 At exact time"), real.formatForDisplay(parsed));
        assertTrue(real.preview("Call mom tomorrow at 5pm").isPresent());
    }
}
