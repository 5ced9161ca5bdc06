package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Priority {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Priority(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
