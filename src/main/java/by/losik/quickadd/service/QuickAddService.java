package by.losik.quickadd.service;

import by.losik.quickadd.config.ParserConfig;
import by.losik.quickadd.dto.ParsedTask;
import by.losik.quickadd.parser.PatternDetector;
import by.losik.quickadd.parser.ResultFormatter;
import by.losik.quickadd.parser.TaskPipeline;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point for the quick-add box: parses a line, tells whether a line is worth parsing,
 * and renders preview badges.
 */
@Singleton
public class QuickAddService {

    private static final Logger log = LoggerFactory.getLogger(QuickAddService.class);

    private final TaskPipeline pipeline;
    private final PatternDetector detector;
    private final ResultFormatter formatter;
    private final Clock clock;
    private final ParserConfig config;

    @Inject
    public QuickAddService(TaskPipeline pipeline, PatternDetector detector, ResultFormatter formatter,
                           Clock clock, ParserConfig config) {
        this.pipeline = pipeline;
        this.detector = detector;
        this.formatter = formatter;
        this.clock = clock;
        this.config = config;
    }

    /**
     * Parses one line. The current instant is read once here and shared by every stage.
     *
     * @throws NullPointerException if {@code text} is null; blank text is fine and yields an
     *                              empty title
     */
    public ParsedTask parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        LocalDateTime now = LocalDateTime.now(clock);
        log.debug("Parsing '{}' at {}", text, now);
        return pipeline.parse(text, now);
    }

    public boolean looksParseable(String text) {
        return detector.looksParseable(text);
    }

    public List<String> formatForDisplay(ParsedTask parsed) {
        Objects.requireNonNull(parsed, "parsed must not be null");
        return formatter.format(parsed, LocalDateTime.now(clock));
    }

    /**
     * Parse for the live preview. Empty for blank text, and for text the pattern detector
     * rejects while the detection gate is on.
     */
    public Optional<ParsedTask> preview(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        if (config.isDetectionGate() && !detector.looksParseable(text)) {
            log.debug("Skipping preview for '{}': nothing recognisable", text);
            return Optional.empty();
        }
        return Optional.of(parse(text));
    }
}
