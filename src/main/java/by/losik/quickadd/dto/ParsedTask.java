package by.losik.quickadd.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Structured form of one quick-add line. Every field except {@code text} is optional (nullable).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ParsedTask(
        @JsonProperty("text")
        String text,

        @JsonProperty("due_date")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime dueDate,

        @JsonProperty("reminder_time")
        @JsonFormat(shape = JsonFormat.Shape.STRING, pattern = "yyyy-MM-dd'T'HH:mm:ss")
        LocalDateTime reminderTime,

        @JsonProperty("reminder_offset")
        ReminderOffset reminderOffset,

        @JsonProperty("priority")
        Priority priority,

        @JsonProperty("repeat_type")
        RepeatType repeatType,

        @JsonProperty("repeat_days")
        SortedSet<Integer> repeatDays,

        @JsonProperty("advanced_repeat")
        AdvancedRepeat advancedRepeat,

        @JsonProperty("location")
        String location,

        @JsonProperty("tags")
        Set<String> tags,

        @JsonProperty("folder_name")
        String folderName,

        @JsonProperty("description")
        String description,

        @JsonProperty("estimated_hours")
        Double estimatedHours
) {

    /** True when nothing but the title was recognised. */
    @JsonIgnore
    public boolean isTextOnly() {
        return dueDate == null && reminderTime == null && reminderOffset == null && priority == null
                && repeatType == null && repeatDays == null && advancedRepeat == null && location == null
                && tags == null && folderName == null && description == null && estimatedHours == null;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Mutable accumulator the parsing pipeline writes into, one stage at a time.
     */
    public static final class Builder {
        private String text;
        private LocalDateTime dueDate;
        private LocalDateTime reminderTime;
        private ReminderOffset reminderOffset;
        private Priority priority;
        private RepeatType repeatType;
        private SortedSet<Integer> repeatDays;
        private AdvancedRepeat advancedRepeat;
        private String location;
        private Set<String> tags;
        private String folderName;
        private String description;
        private Double estimatedHours;

        private Builder() {
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder dueDate(LocalDateTime dueDate) {
            this.dueDate = dueDate;
            return this;
        }

        public Builder reminderTime(LocalDateTime reminderTime) {
            this.reminderTime = reminderTime;
            return this;
        }

        public Builder reminderOffset(ReminderOffset reminderOffset) {
            this.reminderOffset = reminderOffset;
            return this;
        }

        public Builder priority(Priority priority) {
            this.priority = priority;
            return this;
        }

        public Builder repeatType(RepeatType repeatType) {
            this.repeatType = repeatType;
            return this;
        }

        public Builder repeatDays(Collection<Integer> repeatDays) {
            this.repeatDays = repeatDays == null ? null : new TreeSet<>(repeatDays);
            return this;
        }

        public Builder advancedRepeat(AdvancedRepeat advancedRepeat) {
            this.advancedRepeat = advancedRepeat;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder tags(Collection<String> tags) {
            this.tags = tags == null ? null : new LinkedHashSet<>(tags);
            return this;
        }

        public Builder folderName(String folderName) {
            this.folderName = folderName;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder estimatedHours(Double estimatedHours) {
            this.estimatedHours = estimatedHours;
            return this;
        }

        public LocalDateTime dueDate() {
            return dueDate;
        }

        public LocalDateTime reminderTime() {
            return reminderTime;
        }

        public ReminderOffset reminderOffset() {
            return reminderOffset;
        }

        public RepeatType repeatType() {
            return repeatType;
        }

        public AdvancedRepeat advancedRepeat() {
            return advancedRepeat;
        }

        public ParsedTask build() {
            RepeatType effectiveRepeat = advancedRepeat != null ? advancedRepeat.frequency() : repeatType;

            SortedSet<Integer> days = null;
            if (effectiveRepeat == RepeatType.CUSTOM && repeatDays != null && !repeatDays.isEmpty()) {
                days = Collections.unmodifiableSortedSet(new TreeSet<>(repeatDays));
            }

            Set<String> tagSet = null;
            if (tags != null && !tags.isEmpty()) {
                tagSet = Collections.unmodifiableSet(new LinkedHashSet<>(tags));
            }

            // an offset only means something relative to a reminder moment
            ReminderOffset offset = reminderTime != null ? reminderOffset : null;

            return new ParsedTask(text, dueDate, reminderTime, offset, priority, effectiveRepeat, days,
                    advancedRepeat, location, tagSet, folderName, description, estimatedHours);
        }
    }
}
