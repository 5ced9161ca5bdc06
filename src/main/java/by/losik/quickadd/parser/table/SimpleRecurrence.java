package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.RepeatType;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * @param type repeat type
 * @param days weekday indexes (0 = Sunday) for {@link RepeatType#CUSTOM}, empty otherwise
 */
public record SimpleRecurrence(RepeatType type, SortedSet<Integer> days) {

    public SimpleRecurrence {
        days = Collections.unmodifiableSortedSet(new TreeSet<>(days));
    }

    public static SimpleRecurrence of(RepeatType type) {
        return new SimpleRecurrence(type, new TreeSet<>());
    }

    public static SimpleRecurrence onDays(SortedSet<Integer> days) {
        return new SimpleRecurrence(RepeatType.CUSTOM, days);
    }
}
