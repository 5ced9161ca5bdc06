package by.losik.quickadd.parser.table;

import java.time.DayOfWeek;
import java.util.Locale;
import java.util.Map;

/**
 * Weekday and month words shared by the tables. Lookups go by three-letter prefix, so
 * "tue", "tues" and "tuesday" all resolve the same way.
 */
final class Vocabulary {

    static final String WEEKDAY_SHORT_OR_LONG =
            "mon(?:day)?|tue(?:s(?:day)?)?|wed(?:nesday)?|thu(?:r(?:s(?:day)?)?)?|fri(?:day)?|sat(?:urday)?|sun(?:day)?";

    static final String MONTH =
            "jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|jun(?:e)?|jul(?:y)?|aug(?:ust)?"
                    + "|sep(?:tember)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?";

    private static final Map<String, DayOfWeek> WEEKDAYS = Map.of(
            "mon", DayOfWeek.MONDAY,
            "tue", DayOfWeek.TUESDAY,
            "wed", DayOfWeek.WEDNESDAY,
            "thu", DayOfWeek.THURSDAY,
            "fri", DayOfWeek.FRIDAY,
            "sat", DayOfWeek.SATURDAY,
            "sun", DayOfWeek.SUNDAY
    );

    private static final Map<String, Integer> MONTHS = Map.ofEntries(
            Map.entry("jan", 1), Map.entry("feb", 2), Map.entry("mar", 3), Map.entry("apr", 4),
            Map.entry("may", 5), Map.entry("jun", 6), Map.entry("jul", 7), Map.entry("aug", 8),
            Map.entry("sep", 9), Map.entry("oct", 10), Map.entry("nov", 11), Map.entry("dec", 12)
    );

    private Vocabulary() {
    }

    static DayOfWeek weekday(String token) {
        DayOfWeek day = WEEKDAYS.get(prefix(token));
        if (day == null) {
            throw new IllegalArgumentException("Unknown weekday: " + token);
        }
        return day;
    }

    static int month(String token) {
        Integer month = MONTHS.get(prefix(token));
        if (month == null) {
            throw new IllegalArgumentException("Unknown month: " + token);
        }
        return month;
    }

    private static String prefix(String token) {
        String lower = token.trim().toLowerCase(Locale.ROOT);
        return lower.length() > 3 ? lower.substring(0, 3) : lower;
    }
}
