package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How a monthly recurrence picks its day: a fixed day-of-month, or an ordinal weekday.
 */
public enum MonthlyType {
    DATE("date"),
    WEEKDAY("weekday");

    private final String wireName;

    MonthlyType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
