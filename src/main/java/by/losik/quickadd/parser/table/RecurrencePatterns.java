package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.RepeatType;
import by.losik.quickadd.parser.CalendarMath;

import java.time.DayOfWeek;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Plain recurrences: fixed frequencies, weekday/weekend sets and custom weekday lists.
 *
 * <p>The weekday list ("every mon, wed and fri") is tried before the single weekday rules,
 * otherwise "every mon" would claim the head of the list and drop the rest.
 */
public final class RecurrencePatterns {

    private static final Pattern WEEKDAY_TOKEN =
            Pattern.compile("\\b(" + Vocabulary.WEEKDAY_SHORT_OR_LONG + ")\\b", Pattern.CASE_INSENSITIVE);

    public static final PatternTable<SimpleRecurrence> TABLE = new PatternTable<SimpleRecurrence>("recurrence",
            PatternRule.constant("\\b(?:every\\s*hour|hourly)\\b", SimpleRecurrence.of(RepeatType.HOURLY)),
            PatternRule.constant("\\b(?:every\\s*day|daily)\\b", SimpleRecurrence.of(RepeatType.DAILY)),
            PatternRule.constant("\\b(?:every\\s*week|weekly)\\b", SimpleRecurrence.of(RepeatType.WEEKLY)),
            PatternRule.constant("\\b(?:every\\s*month|monthly)\\b", SimpleRecurrence.of(RepeatType.MONTHLY)),
            PatternRule.constant("\\b(?:every\\s*year|yearly|annually)\\b", SimpleRecurrence.of(RepeatType.YEARLY)),
            PatternRule.constant("\\b(?:every\\s*weekday|weekdays|on\\s*weekdays)\\b",
                    SimpleRecurrence.of(RepeatType.WEEKDAYS)),
            PatternRule.constant("\\b(?:every\\s*weekend|weekends|on\\s*weekends)\\b",
                    SimpleRecurrence.of(RepeatType.WEEKENDS)),
            PatternRule.of("\\bevery\\s+((?:(?:" + Vocabulary.WEEKDAY_SHORT_OR_LONG + ")\\s*(?:,|and|&)\\s*)+(?:"
                            + Vocabulary.WEEKDAY_SHORT_OR_LONG + "))\\b",
                    (m, now) -> SimpleRecurrence.onDays(weekdayList(m.group(1)))),
            single("monday|mon", DayOfWeek.MONDAY),
            single("tuesday|tues|tue", DayOfWeek.TUESDAY),
            single("wednesday|wed", DayOfWeek.WEDNESDAY),
            single("thursday|thurs|thu", DayOfWeek.THURSDAY),
            single("friday|fri", DayOfWeek.FRIDAY),
            single("saturday|sat", DayOfWeek.SATURDAY),
            single("sunday|sun", DayOfWeek.SUNDAY)
    );

    private RecurrencePatterns() {
    }

    private static PatternRule<SimpleRecurrence> single(String names, DayOfWeek day) {
        SortedSet<Integer> days = new TreeSet<>();
        days.add(CalendarMath.weekdayIndex(day));
        return PatternRule.constant("\\bevery\\s*(" + names + ")\\b", SimpleRecurrence.onDays(days));
    }

    static SortedSet<Integer> weekdayList(String list) {
        SortedSet<Integer> days = new TreeSet<>();
        Matcher matcher = WEEKDAY_TOKEN.matcher(list);
        while (matcher.find()) {
            days.add(CalendarMath.weekdayIndex(Vocabulary.weekday(matcher.group(1))));
        }
        return days;
    }
}
