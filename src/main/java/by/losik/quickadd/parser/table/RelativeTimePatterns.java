package by.losik.quickadd.parser.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;

/**
 * "In N minutes" style offsets from the reference instant. Day, week and month offsets
 * belong to {@link DatePatterns}, which resolves them to a calendar day instead.
 */
public final class RelativeTimePatterns {

    private static final Logger log = LoggerFactory.getLogger(RelativeTimePatterns.class);

    public static final PatternTable<LocalDateTime> TABLE = new PatternTable<LocalDateTime>("relative-time",
            PatternRule.of("\\bin\\s+(\\d+)\\s*(?:min(?:ute)?s?)\\b",
                    (m, now) -> offset(now, m.group(1), ChronoUnit.MINUTES)),
            PatternRule.of("\\bin\\s+(\\d+)\\s*(?:hour?s?|hr?s?)\\b",
                    (m, now) -> offset(now, m.group(1), ChronoUnit.HOURS)),
            PatternRule.of("\\bin\\s+(?:half\\s+an?\\s+hour|30\\s*min)",
                    (m, now) -> now.plusMinutes(30)),
            PatternRule.of("\\bin\\s+an?\\s+hour\\b",
                    (m, now) -> now.plusHours(1))
    );

    private RelativeTimePatterns() {
    }

    private static LocalDateTime offset(LocalDateTime now, String amount, ChronoUnit unit) {
        try {
            return now.plus(Long.parseLong(amount), unit);
        } catch (NumberFormatException | DateTimeException | ArithmeticException e) {
            log.debug("Failed to parse relative time: {}", e.getMessage());
            return null;
        }
    }
}
