package by.losik.quickadd.parser.extract;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;

class DescriptionExtractorTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private final DescriptionExtractor extractor = new DescriptionExtractor();

    @ParameterizedTest
    @ValueSource(strings = {"Fix login // check the token expiry", "Fix login -- check the token expiry",
            "Fix login | check the token expiry"})
    void extract_WithSeparator_ShouldReturnTrailingNotes(String text) {
        StageMatch<String> match = extractor.extract(text, NOW).orElseThrow();

        Assertions.assertEquals("check the token expiry", match.value());
        Assertions.assertEquals("Fix login", text.replace(match.span(), ""));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Visit http://example.com", "Pros/cons list", "a--b"})
    void extract_WithoutSpacedSeparator_ShouldReturnEmpty(String text) {
        Assertions.assertTrue(extractor.extract(text, NOW).isEmpty());
    }

    @Test
    void extract_ShouldTakeFromFirstSeparator() {
        Assertions.assertEquals("one | two",
                extractor.extract("Task // one | two", NOW).orElseThrow().value());
    }
}
