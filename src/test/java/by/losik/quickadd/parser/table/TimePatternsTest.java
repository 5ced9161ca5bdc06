package by.losik.quickadd.parser.table;

import by.losik.quickadd.parser.extract.StageMatch;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDateTime;
import java.time.LocalTime;

class TimePatternsTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 1, 1, 10, 0);

    private static LocalTime resolve(String text) {
        return TimePatterns.TABLE.extract(text, NOW).map(StageMatch::value).orElse(null);
    }

    @ParameterizedTest
    @CsvSource({
            "at 5pm, 17:00",
            "at 5, 05:00",
            "at 12am, 00:00",
            "at 12pm, 12:00",
            "at 9:15 AM, 09:15",
            "7:45pm, 19:45",
            "11am, 11:00",
            "18:30, 18:30",
            "in the morning, 09:00",
            "in the afternoon, 14:00",
            "in the evening, 18:00",
            "in the night, 21:00"
    })
    void extract_WithClockPhrase_ShouldResolve(String text, LocalTime expected) {
        Assertions.assertEquals(expected, resolve(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"at 25", "24:00", "10:75", "no time here"})
    void extract_WithOutOfRangeTime_ShouldDecline(String text) {
        Assertions.assertNull(resolve(text));
    }
}
