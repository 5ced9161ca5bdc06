package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.AdvancedRepeat;

import java.time.LocalDateTime;

/**
 * @param repeat          recurrence descriptor
 * @param firstOccurrence first due moment implied by the recurrence, or null when the
 *                        recurrence does not pin one down (e.g. "every 3 days")
 */
public record AdvancedRecurrence(AdvancedRepeat repeat, LocalDateTime firstOccurrence) {
}
