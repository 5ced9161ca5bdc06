package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lead time between a reminder and the due moment it belongs to.
 */
public enum ReminderOffset {
    EXACT("exact", 0),
    FIVE_MINUTES("5min", 5),
    TEN_MINUTES("10min", 10),
    FIFTEEN_MINUTES("15min", 15),
    THIRTY_MINUTES("30min", 30),
    ONE_HOUR("1hour", 60),
    ONE_DAY("1day", 1440);

    private final String wireName;
    private final int minutes;

    ReminderOffset(String wireName, int minutes) {
        this.wireName = wireName;
        this.minutes = minutes;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public int minutes() {
        return minutes;
    }

    /**
     * Buckets a free-form minute count into the smallest supported tier that covers it.
     * Anything above thirty minutes becomes {@link #ONE_HOUR}.
     */
    public static ReminderOffset forMinutes(int minutes) {
        if (minutes <= 5) {
            return FIVE_MINUTES;
        } else if (minutes <= 10) {
            return TEN_MINUTES;
        } else if (minutes <= 15) {
            return FIFTEEN_MINUTES;
        } else if (minutes <= 30) {
            return THIRTY_MINUTES;
        }
        return ONE_HOUR;
    }
}
