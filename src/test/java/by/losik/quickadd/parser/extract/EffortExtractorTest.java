package by.losik.quickadd.parser.extract;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

class EffortExtractorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private EffortExtractor extractor;

    @BeforeEach
    void setUp() {
        extractor = new EffortExtractor();
    }

    @ParameterizedTest
    @CsvSource({
            "'Write report ~2h', 2.0",
            "'Write report ~1.5h', 1.5",
            "'Write report ~1h30m', 1.5",
            "'Write report ~45m', 0.75",
            "'Write report est:2h', 2.0",
            "'Write report estimate: 3 hours', 3.0",
            "'Write report effort:30m', 0.5",
            "'Write report ~90 min', 1.5"
    })
    void extract_WithEstimate_ShouldReturnHours(String text, double expected) {
        StageMatch<Double> match = extractor.extract(text, NOW).orElseThrow();

        Assertions.assertEquals(expected, match.value(), 1e-9);
    }

    @Test
    void extract_ShouldReportWholeToken() {
        Assertions.assertEquals("~1h30m", extractor.extract("Deck ~1h30m #work", NOW).orElseThrow().span());
    }

    @ParameterizedTest
    @ValueSource(strings = {"Write report", "Call at 2pm", "Room 30m away"})
    void extract_WithoutMarker_ShouldReturnEmpty(String text) {
        Assertions.assertTrue(extractor.extract(text, NOW).isEmpty());
    }
}
