package by.losik.quickadd.parser.table;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.regex.MatchResult;

/**
 * Clock-time phrases. A time never picks a day on its own; the pipeline applies it to
 * whatever day is already established.
 */
public final class TimePatterns {

    private static final Logger log = LoggerFactory.getLogger(TimePatterns.class);

    public static final PatternTable<LocalTime> TABLE = new PatternTable<LocalTime>("time",
            PatternRule.of("\\bat\\s+(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)?\\b", TimePatterns::clock),
            PatternRule.of("\\b(\\d{1,2})(?::(\\d{2}))?\\s*(am|pm)\\b", TimePatterns::clock),
            PatternRule.caseSensitive("\\b(\\d{1,2}):(\\d{2})\\b", TimePatterns::clock),
            PatternRule.of("\\bin the (morning|afternoon|evening|night)\\b",
                    (m, now) -> partOfDay(m.group(1)))
    );

    private TimePatterns() {
    }

    private static LocalTime clock(MatchResult m, LocalDateTime now) {
        int hours = Integer.parseInt(m.group(1));
        int minutes = m.group(2) != null ? Integer.parseInt(m.group(2)) : 0;
        String period = m.groupCount() >= 3 && m.group(3) != null ? m.group(3).toLowerCase(Locale.ROOT) : null;

        if ("pm".equals(period) && hours < 12) {
            hours += 12;
        } else if ("am".equals(period) && hours == 12) {
            hours = 0;
        }

        if (hours > 23 || minutes > 59) {
            log.debug("Ignoring out-of-range time {}:{} in '{}'", hours, minutes, m.group());
            return null;
        }
        return LocalTime.of(hours, minutes);
    }

    private static LocalTime partOfDay(String part) {
        return switch (part.toLowerCase(Locale.ROOT)) {
            case "afternoon" -> LocalTime.of(14, 0);
            case "evening" -> LocalTime.of(18, 0);
            case "night" -> LocalTime.of(21, 0);
            default -> LocalTime.of(9, 0);
        };
    }
}
