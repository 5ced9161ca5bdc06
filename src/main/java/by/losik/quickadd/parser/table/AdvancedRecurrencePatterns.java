package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.AdvancedRepeat;
import by.losik.quickadd.dto.RepeatType;
import by.losik.quickadd.parser.CalendarMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Recurrences that need more than a repeat type: ordinal weekdays of the month, numeric
 * intervals and the last day of the month.
 */
public final class AdvancedRecurrencePatterns {

    private static final Logger log = LoggerFactory.getLogger(AdvancedRecurrencePatterns.class);

    private static final Map<String, Integer> ORDINALS = Map.of(
            "1st", 1, "first", 1,
            "2nd", 2, "second", 2,
            "3rd", 3, "third", 3,
            "4th", 4, "fourth", 4,
            "last", AdvancedRepeat.LAST_WEEK
    );

    private static final Map<String, RepeatType> INTERVAL_UNITS = Map.of(
            "day", RepeatType.DAILY,
            "week", RepeatType.WEEKLY,
            "month", RepeatType.MONTHLY
    );

    public static final PatternTable<AdvancedRecurrence> TABLE = new PatternTable<AdvancedRecurrence>("advanced-recurrence",
            PatternRule.of("\\bevery\\s+(1st|2nd|3rd|4th|last|first|second|third|fourth)\\s+"
                            + "(monday|tuesday|wednesday|thursday|friday|saturday|sunday|mon|tue|wed|thu|fri|sat|sun)\\b",
                    (m, now) -> {
                        int week = ORDINALS.get(m.group(1).toLowerCase(Locale.ROOT));
                        DayOfWeek day = Vocabulary.weekday(m.group(2));
                        return new AdvancedRecurrence(
                                AdvancedRepeat.nthWeekday(week, CalendarMath.weekdayIndex(day)),
                                CalendarMath.nthWeekdayOfMonth(now, week, day));
                    }),
            PatternRule.of("\\bevery\\s+(\\d+)\\s*(?:hour?s?|hr?s?)\\b",
                    (m, now) -> interval(RepeatType.HOURLY, m.group(1))),
            PatternRule.of("\\bevery\\s+(\\d+)\\s+(day|week|month)s?\\b",
                    (m, now) -> interval(INTERVAL_UNITS.get(m.group(2).toLowerCase(Locale.ROOT)), m.group(1))),
            PatternRule.of("\\b(?:every\\s+)?last\\s+day\\s+(?:of\\s+(?:the\\s+)?)?month\\b",
                    (m, now) -> {
                        LocalDate lastDay = CalendarMath.lastDayOfMonth(now);
                        return new AdvancedRecurrence(
                                AdvancedRepeat.monthlyOnDate(lastDay.getDayOfMonth()),
                                lastDay.atStartOfDay());
                    })
    );

    private AdvancedRecurrencePatterns() {
    }

    private static AdvancedRecurrence interval(RepeatType frequency, String amount) {
        try {
            return new AdvancedRecurrence(AdvancedRepeat.every(frequency, Integer.parseInt(amount)), null);
        } catch (NumberFormatException e) {
            log.debug("Failed to parse recurrence interval: {}", e.getMessage());
            return null;
        }
    }
}
