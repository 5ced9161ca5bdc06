package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A recurrence that a repeat type plus a weekday set cannot express.
 *
 * @param frequency   base frequency, mirrored into {@link ParsedTask#repeatType()}
 * @param interval    every N units of the frequency, or null for every single unit
 * @param monthlyType how a monthly recurrence picks its day
 * @param monthlyWeek ordinal week 1..4, or {@link #LAST_WEEK} for the last one
 * @param monthlyDay  weekday index 0..6 (Sunday first) for {@link MonthlyType#WEEKDAY},
 *                    day of month 1..31 for {@link MonthlyType#DATE}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AdvancedRepeat(
        @JsonProperty("frequency")
        RepeatType frequency,

        @JsonProperty("interval")
        Integer interval,

        @JsonProperty("monthly_type")
        MonthlyType monthlyType,

        @JsonProperty("monthly_week")
        Integer monthlyWeek,

        @JsonProperty("monthly_day")
        Integer monthlyDay
) {
    public static final int LAST_WEEK = -1;

    public static AdvancedRepeat nthWeekday(int week, int weekdayIndex) {
        return new AdvancedRepeat(RepeatType.MONTHLY, null, MonthlyType.WEEKDAY, week, weekdayIndex);
    }

    public static AdvancedRepeat monthlyOnDate(int dayOfMonth) {
        return new AdvancedRepeat(RepeatType.MONTHLY, null, MonthlyType.DATE, null, dayOfMonth);
    }

    public static AdvancedRepeat every(RepeatType frequency, int interval) {
        return new AdvancedRepeat(frequency, interval, null, null, null);
    }
}
