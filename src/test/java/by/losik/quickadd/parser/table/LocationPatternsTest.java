package by.losik.quickadd.parser.table;

import by.losik.quickadd.parser.extract.StageMatch;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDateTime;

class LocationPatternsTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private static String resolve(String text) {
        return LocationPatterns.TABLE.extract(text, NOW).map(StageMatch::value).orElse(null);
    }

    @ParameterizedTest
    @CsvSource({
            "'Meeting at the office', office",
            "'Workout at GYM', GYM",
            "'Coffee at Blue Bottle', Blue Bottle",
            "'Dinner at Olive Garden', Olive Garden"
    })
    void extract_WithPlace_ShouldCapturePlace(String text, String expected) {
        Assertions.assertEquals(expected, resolve(text));
    }

    @Test
    void extract_WithKnownPlace_ShouldConsumeArticle() {
        Assertions.assertEquals("at the library", LocationPatterns.TABLE.extract("Return books at the library", NOW)
                .orElseThrow().span());
    }

    @Test
    void extract_WithLowercaseUnknownPlace_ShouldReturnEmpty() {
        Assertions.assertNull(resolve("meet at lunch"));
    }

    @Test
    void extract_WithSingleLetter_ShouldReturnEmpty() {
        Assertions.assertNull(resolve("Look at X"));
    }

    @Test
    void extract_WithApostrophe_ShouldKeepWholeName() {
        Assertions.assertEquals("Joe's Diner", resolve("Dinner at Joe's Diner"));
    }

    @Test
    void extract_WithUppercaseAt_ShouldStillFindKnownPlace() {
        Assertions.assertEquals("Home", resolve("AT Home Depot"));
    }
}
