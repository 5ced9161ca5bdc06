package by.losik.quickadd.parser;

import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.dto.ReminderOffset;
import by.losik.quickadd.dto.RepeatType;
import by.losik.quickadd.parser.extract.DateExtractor;
import by.losik.quickadd.parser.extract.DescriptionExtractor;
import by.losik.quickadd.parser.extract.EffortExtractor;
import by.losik.quickadd.parser.extract.FolderExtractor;
import by.losik.quickadd.parser.extract.StageExtractor;
import by.losik.quickadd.parser.extract.StageMatch;
import by.losik.quickadd.parser.extract.TagExtractor;
import by.losik.quickadd.parser.table.AdvancedRecurrence;
import by.losik.quickadd.parser.table.AdvancedRecurrencePatterns;
import by.losik.quickadd.parser.table.LocationPatterns;
import by.losik.quickadd.parser.table.PriorityPatterns;
import by.losik.quickadd.parser.table.RecurrencePatterns;
import by.losik.quickadd.parser.table.RelativeTimePatterns;
import by.losik.quickadd.parser.table.ReminderPatterns;
import by.losik.quickadd.parser.table.SimpleRecurrence;
import by.losik.quickadd.parser.table.TimePatterns;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Runs the extraction stages in their fixed order over one line of text.
 *
 * <p>Order: description, effort, tags, folder, reminder phrase, advanced recurrence,
 * simple recurrence, relative time, date, recurrence start, clock time, reminder offset,
 * priority, location.
 * Quick-syntax markers go first because their characters would confuse the word rules;
 * recurrence precedes dates so "every monday" is not read as "monday"; priority and
 * location are the loosest rules and only see what nothing else claimed.
 */
@Singleton
public class TaskPipeline {

    private static final Logger log = LoggerFactory.getLogger(TaskPipeline.class);

    private record Stage(String name, Consumer<ParseContext> step) {
    }

    private final DescriptionExtractor descriptionExtractor = new DescriptionExtractor();
    private final EffortExtractor effortExtractor = new EffortExtractor();
    private final TagExtractor tagExtractor = new TagExtractor();
    private final FolderExtractor folderExtractor = new FolderExtractor();
    private final DateExtractor dateExtractor = new DateExtractor();
    private final TextCanonicalizer canonicalizer;
    private final List<Stage> stages;

    @Inject
    public TaskPipeline(TextCanonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
        this.stages = List.of(
                new Stage("description", this::applyDescription),
                new Stage("effort", this::applyEffort),
                new Stage("tags", this::applyTags),
                new Stage("folder", this::applyFolder),
                new Stage("reminder-phrase", this::applyReminderPhrase),
                new Stage("advanced-recurrence", this::applyAdvancedRecurrence),
                new Stage("recurrence", this::applyRecurrence),
                new Stage("relative-time", this::applyRelativeTime),
                new Stage("date", this::applyDate),
                new Stage("recurrence-start", this::applyRecurrenceStart),
                new Stage("time", this::applyTime),
                new Stage("reminder-offset", this::applyReminderOffset),
                new Stage("priority", this::applyPriority),
                new Stage("location", this::applyLocation)
        );
    }

    public TaskPipeline() {
        this(new TextCanonicalizer());
    }

    /**
     * Parses one line against a fixed reference instant. Every stage sees the same
     * {@code now}.
     */
    public ParsedTask parse(String input, LocalDateTime now) {
        ParseContext ctx = new ParseContext(input, now);
        for (Stage stage : stages) {
            stage.step().accept(ctx);
        }

        String title = canonicalizer.canonicalize(ctx.buffer(), ctx.consumedAnything());
        ParsedTask parsed = ctx.result()
                .text(title.isEmpty() ? input.trim() : title)
                .build();
        log.debug("Parsed '{}' into {}", input, parsed);
        return parsed;
    }

    private void applyDescription(ParseContext ctx) {
        run("description", descriptionExtractor, ctx)
                .ifPresent(match -> ctx.result().description(match.value()));
    }

    private void applyEffort(ParseContext ctx) {
        run("effort", effortExtractor, ctx)
                .ifPresent(match -> ctx.result().estimatedHours(match.value()));
    }

    private void applyTags(ParseContext ctx) {
        run("tags", tagExtractor, ctx)
                .ifPresent(match -> ctx.result().tags(match.value()));
    }

    private void applyFolder(ParseContext ctx) {
        run("folder", folderExtractor, ctx)
                .ifPresent(match -> ctx.result().folderName(match.value()));
    }

    private void applyReminderPhrase(ParseContext ctx) {
        run("reminder-phrase", ReminderPatterns.TABLE, ctx)
                .ifPresent(match -> ctx.result().reminderOffset(match.value()));
    }

    private void applyAdvancedRecurrence(ParseContext ctx) {
        run("advanced-recurrence", AdvancedRecurrencePatterns.TABLE, ctx).ifPresent(match -> {
            AdvancedRecurrence recurrence = match.value();
            ctx.result()
                    .advancedRepeat(recurrence.repeat())
                    .repeatType(recurrence.repeat().frequency());
            if (recurrence.firstOccurrence() != null) {
                ctx.result().dueDate(recurrence.firstOccurrence());
            }
        });
    }

    private void applyRecurrence(ParseContext ctx) {
        if (ctx.result().advancedRepeat() != null) {
            return;
        }
        run("recurrence", RecurrencePatterns.TABLE, ctx).ifPresent(match -> {
            SimpleRecurrence recurrence = match.value();
            ctx.result().repeatType(recurrence.type());
            LocalDateTime now = ctx.now();

            if (!recurrence.days().isEmpty()) {
                ctx.result()
                        .repeatDays(recurrence.days())
                        .dueDate(CalendarMath.nextCustomDay(now, recurrence.days()));
            } else if (recurrence.type() == RepeatType.WEEKDAYS) {
                ctx.result().dueDate(CalendarMath.nextWeekday(now));
            } else if (recurrence.type() == RepeatType.WEEKENDS) {
                ctx.result().dueDate(CalendarMath.nextSaturday(now));
            }
        });
    }

    private void applyRelativeTime(ParseContext ctx) {
        run("relative-time", RelativeTimePatterns.TABLE, ctx).ifPresent(match -> {
            ParsedTask.Builder result = ctx.result();
            result.dueDate(match.value()).reminderTime(match.value());
            if (result.reminderOffset() == null) {
                result.reminderOffset(ReminderOffset.EXACT);
            }
        });
    }

    private void applyDate(ParseContext ctx) {
        if (ctx.result().dueDate() != null) {
            return;
        }
        run("date", dateExtractor, ctx)
                .ifPresent(match -> ctx.result().dueDate(match.value()));
    }

    /**
     * A recurrence with no date of its own starts now: hourly at the current minute, anything
     * else at today's midnight. A clock time, if any, is applied on top by the time stage.
     */
    private void applyRecurrenceStart(ParseContext ctx) {
        ParsedTask.Builder result = ctx.result();
        if (result.dueDate() != null || result.repeatType() == null) {
            return;
        }
        LocalDateTime now = ctx.now();
        result.dueDate(result.repeatType() == RepeatType.HOURLY
                ? now.truncatedTo(ChronoUnit.MINUTES)
                : CalendarMath.startOfDay(now));
    }

    /**
     * Matched against the untouched input: a time phrase may share words with a date phrase
     * that an earlier stage already cut out of the buffer. Whatever is left of it in the
     * buffer is then cut as whole words.
     */
    private void applyTime(ParseContext ctx) {
        Optional<StageMatch<LocalTime>> found = TimePatterns.TABLE.extract(ctx.input(), ctx.now());
        found.ifPresent(match -> {
            match.texts().forEach(text -> ctx.consumeText("time", text));
            ParsedTask.Builder result = ctx.result();
            LocalTime time = match.value();
            LocalDateTime day = result.dueDate() != null ? result.dueDate() : CalendarMath.startOfDay(ctx.now());
            LocalDateTime due = day.with(time);
            result.dueDate(due).reminderTime(due);
            if (result.reminderOffset() == null) {
                result.reminderOffset(ReminderOffset.EXACT);
            }
        });
    }

    private void applyReminderOffset(ParseContext ctx) {
        ParsedTask.Builder result = ctx.result();
        ReminderOffset offset = result.reminderOffset();
        if (offset == null) {
            return;
        }
        if (result.reminderTime() == null && result.dueDate() != null) {
            result.reminderTime(result.dueDate());
        }
        if (result.reminderTime() != null && offset != ReminderOffset.EXACT) {
            result.reminderTime(result.reminderTime().minusMinutes(offset.minutes()));
        }
    }

    private void applyPriority(ParseContext ctx) {
        run("priority", PriorityPatterns.TABLE, ctx)
                .ifPresent(match -> ctx.result().priority(match.value()));
    }

    private void applyLocation(ParseContext ctx) {
        run("location", LocationPatterns.TABLE, ctx)
                .ifPresent(match -> ctx.result().location(match.value()));
    }

    private <T> Optional<StageMatch<T>> run(String stage, StageExtractor<T> extractor, ParseContext ctx) {
        Optional<StageMatch<T>> match = extractor.extract(ctx.buffer(), ctx.now());
        match.ifPresent(m -> ctx.consume(stage, m.spans()));
        return match;
    }
}
