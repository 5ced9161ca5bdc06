package by.losik.quickadd.parser;

import by.losik.quickadd.dto.AdvancedRepeat;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.MonthDay;
import java.time.YearMonth;
import java.time.temporal.TemporalAdjusters;
import java.util.SortedSet;

/**
 * Calendar arithmetic for the parser. Every method takes the reference instant explicitly;
 * nothing here reads the system clock.
 *
 * <p>Weekday indexes follow the task model: 0 is Sunday, 6 is Saturday.
 */
public final class CalendarMath {

    private CalendarMath() {
    }

    public static int weekdayIndex(DayOfWeek day) {
        return day.getValue() % 7;
    }

    public static DayOfWeek dayOfWeek(int weekdayIndex) {
        return weekdayIndex == 0 ? DayOfWeek.SUNDAY : DayOfWeek.of(weekdayIndex);
    }

    public static LocalDateTime startOfDay(LocalDateTime moment) {
        return moment.toLocalDate().atStartOfDay();
    }

    /** Days until the next {@code target} strictly after today: 1..7, never 0. */
    public static int daysUntilNext(LocalDateTime now, DayOfWeek target) {
        int diff = (weekdayIndex(target) - weekdayIndex(now.getDayOfWeek()) + 7) % 7;
        return diff == 0 ? 7 : diff;
    }

    /**
     * Resolves a weekday name. Plain "friday" is the next Friday after today; "next friday",
     * or plain "friday" said on a Friday, skips one day first, so it lands on the Friday after
     * tomorrow at the earliest.
     */
    public static LocalDateTime resolveWeekday(LocalDateTime now, DayOfWeek target, boolean explicitNext) {
        LocalDate today = now.toLocalDate();
        LocalDate base = explicitNext || today.getDayOfWeek() == target ? today.plusDays(1) : today;
        return base.with(TemporalAdjusters.next(target)).atStartOfDay();
    }

    /**
     * Builds a month/day literal in the current year, rolling to next year once that day's
     * midnight has passed. Today's date therefore rolls unless {@code now} is exactly midnight.
     */
    public static LocalDateTime resolveMonthDay(LocalDateTime now, int month, int day) {
        LocalDateTime date = MonthDay.of(month, day).atYear(now.getYear()).atStartOfDay();
        if (date.isBefore(now)) {
            date = MonthDay.of(month, day).atYear(now.getYear() + 1).atStartOfDay();
        }
        return date;
    }

    public static LocalDate lastDayOfMonth(LocalDateTime now) {
        return YearMonth.from(now).atEndOfMonth();
    }

    /**
     * First occurrence of the {@code week}-th {@code target} weekday of a month that is not
     * before {@code now}. {@code week} is 1..4 or {@link AdvancedRepeat#LAST_WEEK}. Each month
     * is evaluated on its own calendar, since the ordinal day moves from month to month.
     */
    public static LocalDateTime nthWeekdayOfMonth(LocalDateTime now, int week, DayOfWeek target) {
        YearMonth month = YearMonth.from(now);
        while (true) {
            LocalDateTime candidate = nthWeekdayIn(month, week, target).atStartOfDay();
            if (!candidate.isBefore(now)) {
                return candidate;
            }
            month = month.plusMonths(1);
        }
    }

    static LocalDate nthWeekdayIn(YearMonth month, int week, DayOfWeek target) {
        if (week == AdvancedRepeat.LAST_WEEK) {
            LocalDate date = month.atEndOfMonth();
            while (date.getDayOfWeek() != target) {
                date = date.minusDays(1);
            }
            return date;
        }
        LocalDate date = month.atDay(1);
        while (date.getDayOfWeek() != target) {
            date = date.plusDays(1);
        }
        return date.plusWeeks(week - 1L);
    }

    /**
     * First due day for a custom weekday set: the nearest listed weekday after today,
     * wrapping to the earliest listed one next week.
     */
    public static LocalDateTime nextCustomDay(LocalDateTime now, SortedSet<Integer> weekdayIndexes) {
        int current = weekdayIndex(now.getDayOfWeek());
        int next = weekdayIndexes.stream()
                .filter(d -> d > current)
                .findFirst()
                .orElse(weekdayIndexes.first());
        return startOfDay(now.plusDays(daysUntilNext(now, dayOfWeek(next))));
    }

    /** Tomorrow, unless tomorrow falls on a weekend, in which case the coming Monday. */
    public static LocalDateTime nextWeekday(LocalDateTime now) {
        int days = switch (now.getDayOfWeek()) {
            case FRIDAY -> 3;
            case SATURDAY -> 2;
            default -> 1;
        };
        return startOfDay(now.plusDays(days));
    }

    public static LocalDateTime nextSaturday(LocalDateTime now) {
        return startOfDay(now.plusDays(daysUntilNext(now, DayOfWeek.SATURDAY)));
    }
}
