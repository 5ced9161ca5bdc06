package by.losik.quickadd.dto;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

class ParsedTaskTest {

    private ObjectMapper objectMapper;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
    }

    @Test
    void build_ShouldDropDaysUnlessCustom() {
        ParsedTask daily = ParsedTask.builder().text("t").repeatType(RepeatType.DAILY).repeatDays(List.of(1)).build();
        ParsedTask custom = ParsedTask.builder().text("t").repeatType(RepeatType.CUSTOM).repeatDays(List.of(5, 1)).build();
        ParsedTask emptyCustom = ParsedTask.builder().text("t").repeatType(RepeatType.CUSTOM).repeatDays(List.of()).build();

        Assertions.assertNull(daily.repeatDays());
        Assertions.assertEquals(List.of(1, 5), List.copyOf(custom.repeatDays()));
        Assertions.assertNull(emptyCustom.repeatDays());
    }

    @Test
    void build_WithAdvancedRepeat_ShouldMirrorFrequency() {
        ParsedTask task = ParsedTask.builder().text("t")
                .repeatType(RepeatType.CUSTOM)
                .repeatDays(List.of(2))
                .advancedRepeat(AdvancedRepeat.every(RepeatType.WEEKLY, 2))
                .build();

        Assertions.assertEquals(RepeatType.WEEKLY, task.repeatType());
        Assertions.assertNull(task.repeatDays());
    }

    @Test
    void build_WithoutReminderTime_ShouldDropOffset() {
        ParsedTask task = ParsedTask.builder().text("t").reminderOffset(ReminderOffset.ONE_HOUR).build();

        Assertions.assertNull(task.reminderOffset());
        Assertions.assertTrue(task.isTextOnly());
    }

    @Test
    void build_ShouldCopyCollections() {
        List<String> tags = new ArrayList<>(List.of("a", "b", "a"));
        ParsedTask task = ParsedTask.builder().text("t").tags(tags).build();
        tags.add("c");

        Assertions.assertEquals(List.of("a", "b"), List.copyOf(task.tags()));
        Assertions.assertThrows(UnsupportedOperationException.class, () -> task.tags().add("d"));
        Assertions.assertNull(ParsedTask.builder().text("t").tags(List.of()).build().tags());
    }

    @Test
    void json_ShouldUseSnakeCaseAndOmitNulls() throws Exception {
        LocalDateTime due = LocalDateTime.of(2024, 1, 8, 9, 0);
        ParsedTask task = ParsedTask.builder()
                .text("Team sync")
                .dueDate(due)
                .reminderTime(due.minusMinutes(15))
                .reminderOffset(ReminderOffset.FIFTEEN_MINUTES)
                .repeatType(RepeatType.CUSTOM)
                .repeatDays(List.of(1))
                .priority(Priority.HIGH)
                .estimatedHours(0.5)
                .build();

        JsonNode json = objectMapper.readTree(objectMapper.writeValueAsString(task));

        Assertions.assertEquals("Team sync", json.get("text").asText());
        Assertions.assertEquals("2024-01-08T09:00:00", json.get("due_date").asText());
        Assertions.assertEquals("2024-01-08T08:45:00", json.get("reminder_time").asText());
        Assertions.assertEquals("15min", json.get("reminder_offset").asText());
        Assertions.assertEquals("custom", json.get("repeat_type").asText());
        Assertions.assertEquals(1, json.get("repeat_days").get(0).asInt());
        Assertions.assertEquals("high", json.get("priority").asText());
        Assertions.assertEquals(0.5, json.get("estimated_hours").asDouble(), 1e-9);
        Assertions.assertFalse(json.has("location"));
        Assertions.assertFalse(json.has("advanced_repeat"));
        Assertions.assertFalse(json.has("text_only"));
        Assertions.assertFalse(json.has("textOnly"));
    }

    @Test
    void json_WithAdvancedRepeat_ShouldNestDescriptor() throws Exception {
        ParsedTask task = ParsedTask.builder().text("Submit report")
                .advancedRepeat(AdvancedRepeat.nthWeekday(AdvancedRepeat.LAST_WEEK, 5))
                .build();

        JsonNode repeat = objectMapper.readTree(objectMapper.writeValueAsString(task)).get("advanced_repeat");

        Assertions.assertEquals("monthly", repeat.get("frequency").asText());
        Assertions.assertEquals("weekday", repeat.get("monthly_type").asText());
        Assertions.assertEquals(-1, repeat.get("monthly_week").asInt());
        Assertions.assertEquals(5, repeat.get("monthly_day").asInt());
        Assertions.assertFalse(repeat.has("interval"));
    }
}
