package by.losik.quickadd.parser.table;

import by.losik.quickadd.parser.CalendarMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.regex.MatchResult;

/**
 * Calendar-day phrases. Order matters: named days and shortcuts first, then relative
 * offsets, weekday names and finally literal dates.
 */
public final class DatePatterns {

    private static final Logger log = LoggerFactory.getLogger(DatePatterns.class);

    public static final PatternTable<LocalDateTime> TABLE = new PatternTable<LocalDateTime>("date",
            PatternRule.of("\\btoday\\b", (m, now) -> CalendarMath.startOfDay(now)),
            PatternRule.of("\\btonight\\b", (m, now) -> CalendarMath.startOfDay(now).withHour(21)),
            // ahead of "tomorrow", which would otherwise claim its last word
            PatternRule.of("\\bday after tomorrow\\b", (m, now) -> CalendarMath.startOfDay(now.plusDays(2))),
            PatternRule.of("\\btomorrow\\b", (m, now) -> CalendarMath.startOfDay(now.plusDays(1))),
            PatternRule.of("\\btmr\\b", (m, now) -> CalendarMath.startOfDay(now.plusDays(1))),
            PatternRule.of("\\btmrw\\b", (m, now) -> CalendarMath.startOfDay(now.plusDays(1))),
            PatternRule.of("\\byesterday\\b", (m, now) -> CalendarMath.startOfDay(now.minusDays(1))),

            PatternRule.of("\\b(?:eod|end of (?:the )?day)\\b",
                    (m, now) -> CalendarMath.startOfDay(now).withHour(23)),
            PatternRule.of("\\b(?:eow|end of (?:the )?week)\\b",
                    (m, now) -> CalendarMath.startOfDay(
                            now.plusDays(CalendarMath.daysUntilNext(now, DayOfWeek.FRIDAY))).withHour(17)),
            PatternRule.of("\\b(?:eom|end of (?:the )?month)\\b",
                    (m, now) -> CalendarMath.lastDayOfMonth(now).atTime(17, 0)),

            PatternRule.of("\\bthis\\s+morning\\b", (m, now) -> CalendarMath.startOfDay(now).withHour(9)),
            PatternRule.of("\\bthis\\s+afternoon\\b", (m, now) -> CalendarMath.startOfDay(now).withHour(14)),
            PatternRule.of("\\bthis\\s+evening\\b", (m, now) -> CalendarMath.startOfDay(now).withHour(18)),
            PatternRule.of("\\bthis weekend\\b", (m, now) -> CalendarMath.nextSaturday(now)),
            PatternRule.of("\\bnext week\\b", (m, now) -> CalendarMath.startOfDay(now.plusWeeks(1))),
            PatternRule.of("\\bnext month\\b", (m, now) -> CalendarMath.startOfDay(now.plusMonths(1))),
            PatternRule.of("\\bin (\\d+) days?\\b", (m, now) -> offset(now, m.group(1), ChronoUnit.DAYS)),
            PatternRule.of("\\bin (\\d+) weeks?\\b", (m, now) -> offset(now, m.group(1), ChronoUnit.WEEKS)),
            PatternRule.of("\\bin (\\d+) months?\\b", (m, now) -> offset(now, m.group(1), ChronoUnit.MONTHS)),

            weekday("monday", DayOfWeek.MONDAY),
            weekday("tuesday", DayOfWeek.TUESDAY),
            weekday("wednesday", DayOfWeek.WEDNESDAY),
            weekday("thursday", DayOfWeek.THURSDAY),
            weekday("friday", DayOfWeek.FRIDAY),
            weekday("saturday", DayOfWeek.SATURDAY),
            weekday("sunday", DayOfWeek.SUNDAY),

            // "Dec 25", "December 25th"
            PatternRule.of("\\b(" + Vocabulary.MONTH + ")\\s+(\\d{1,2})(?:st|nd|rd|th)?\\b",
                    (m, now) -> monthDay(now, m.group(1), m.group(2))),
            // "25th December"
            PatternRule.of("\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+(" + Vocabulary.MONTH + ")\\b",
                    (m, now) -> monthDay(now, m.group(2), m.group(1))),
            // M/D, M/D/YY, M/D/YYYY
            PatternRule.caseSensitive("\\b(\\d{1,2})/(\\d{1,2})(?:/(\\d{2,4}))?\\b", DatePatterns::slashDate),
            PatternRule.caseSensitive("\\b(\\d{4})-(\\d{2})-(\\d{2})\\b", DatePatterns::isoDate)
    );

    private DatePatterns() {
    }

    private static PatternRule<LocalDateTime> weekday(String name, DayOfWeek day) {
        return PatternRule.of("\\b(next\\s+)?" + name + "\\b",
                (m, now) -> CalendarMath.resolveWeekday(now, day, m.group(1) != null));
    }

    private static LocalDateTime offset(LocalDateTime now, String amount, ChronoUnit unit) {
        try {
            return CalendarMath.startOfDay(now.plus(Long.parseLong(amount), unit));
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            log.debug("Failed to parse day offset: {}", e.getMessage());
            return null;
        }
    }

    private static LocalDateTime monthDay(LocalDateTime now, String monthName, String day) {
        try {
            return CalendarMath.resolveMonthDay(now, Vocabulary.month(monthName), Integer.parseInt(day));
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Failed to parse month/day literal: {}", e.getMessage());
            return null;
        }
    }

    private static LocalDateTime slashDate(MatchResult m, LocalDateTime now) {
        try {
            int month = Integer.parseInt(m.group(1));
            int day = Integer.parseInt(m.group(2));
            if (m.group(3) == null) {
                return CalendarMath.resolveMonthDay(now, month, day);
            }
            int year = Integer.parseInt(m.group(3));
            if (year < 100) {
                year += 2000;
            }
            return LocalDate.of(year, month, day).atStartOfDay();
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Failed to parse slash date: {}", e.getMessage());
            return null;
        }
    }

    private static LocalDateTime isoDate(MatchResult m, LocalDateTime now) {
        try {
            return LocalDate.of(Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)),
                    Integer.parseInt(m.group(3))).atStartOfDay();
        } catch (DateTimeException | NumberFormatException e) {
            log.debug("Failed to parse ISO date: {}", e.getMessage());
            return null;
        }
    }
}
