package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RepeatType {
    HOURLY("hourly"),
    DAILY("daily"),
    WEEKLY("weekly"),
    MONTHLY("monthly"),
    YEARLY("yearly"),
    WEEKDAYS("weekdays"),
    WEEKENDS("weekends"),
    CUSTOM("custom");

    private final String wireName;

    RepeatType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Capitalized wire name, e.g. "Weekdays". */
    public String label() {
        return Character.toUpperCase(wireName.charAt(0)) + wireName.substring(1);
    }
}
