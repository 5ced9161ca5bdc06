package by.losik.quickadd.parser;

import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.parser.extract.StageMatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * State threaded through one pipeline run: the untouched input, the shrinking working
 * buffer, the reference instant and the result accumulator.
 */
public final class ParseContext {

    private static final Logger log = LoggerFactory.getLogger(ParseContext.class);

    private final String input;
    private final LocalDateTime now;
    private final ParsedTask.Builder result = ParsedTask.builder();
    private String buffer;
    private boolean consumedAnything;

    ParseContext(String input, LocalDateTime now) {
        this.input = input;
        this.now = now;
        this.buffer = input.trim();
    }

    public String input() {
        return input;
    }

    public LocalDateTime now() {
        return now;
    }

    public String buffer() {
        return buffer;
    }

    public ParsedTask.Builder result() {
        return result;
    }

    boolean consumedAnything() {
        return consumedAnything;
    }

    /**
     * Cuts spans located in the current buffer. Positions are taken as reported; a span whose
     * text no longer sits at its position is looked up again as a whole word.
     */
    void consume(String stage, List<StageMatch.Span> spans) {
        List<StageMatch.Span> ordered = spans.stream()
                .sorted(Comparator.comparingInt(StageMatch.Span::start).reversed())
                .toList();
        for (StageMatch.Span span : ordered) {
            if (span.text().isEmpty()) {
                continue;
            }
            if (span.start() >= 0 && buffer.startsWith(span.text(), span.start())) {
                cut(stage, span.start(), span.end());
            } else {
                consumeText(stage, span.text());
            }
        }
        buffer = buffer.trim();
    }

    /**
     * Cuts the first whole-word occurrence of {@code text}. Used for matches made against
     * some other text than the buffer, whose positions mean nothing here.
     */
    void consumeText(String stage, String text) {
        if (text.isEmpty()) {
            return;
        }
        Matcher matcher = wholeWord(text).matcher(buffer);
        if (!matcher.find()) {
            log.debug("Stage {}: '{}' no longer in buffer", stage, text);
            return;
        }
        cut(stage, matcher.start(), matcher.end());
        buffer = buffer.trim();
    }

    private void cut(String stage, int start, int end) {
        String removed = buffer.substring(start, end);
        buffer = buffer.substring(0, start) + buffer.substring(end);
        consumedAnything = true;
        log.debug("Stage {} consumed '{}', buffer now '{}'", stage, removed, buffer);
    }

    private static Pattern wholeWord(String text) {
        String head = Character.isLetterOrDigit(text.charAt(0)) || text.charAt(0) == '_' ? "(?<!\\w)" : "";
        char last = text.charAt(text.length() - 1);
        String tail = Character.isLetterOrDigit(last) || last == '_' ? "(?!\\w)" : "";
        return Pattern.compile(head + Pattern.quote(text) + tail, Pattern.CASE_INSENSITIVE);
    }
}
