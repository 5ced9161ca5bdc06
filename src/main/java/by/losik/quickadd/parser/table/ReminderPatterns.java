package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.ReminderOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * "Remind me ... before" phrases. A bare "remind me" means at the exact time.
 */
public final class ReminderPatterns {

    private static final Logger log = LoggerFactory.getLogger(ReminderPatterns.class);

    private static final String REMIND = "\\b(?:remind(?:\\s+me)?|notify(?:\\s+me)?)";

    public static final PatternTable<ReminderOffset> TABLE = new PatternTable<ReminderOffset>("reminder",
            PatternRule.constant(REMIND + "\\s+(?:at\\s+)?(?:the\\s+)?exact\\s+time\\b", ReminderOffset.EXACT),
            PatternRule.of(REMIND + "\\s+(\\d+)\\s*(?:min(?:ute)?s?)\\s*(?:before|earlier)?\\b",
                    (m, now) -> bucket(m.group(1))),
            PatternRule.constant(REMIND + "\\s+(?:1|one|an?)\\s*(?:hour?s?|hr?s?)\\s*(?:before|earlier)?\\b",
                    ReminderOffset.ONE_HOUR),
            PatternRule.constant(REMIND + "\\s+(?:1|one|a)\\s*(?:day)\\s*(?:before|earlier)?\\b",
                    ReminderOffset.ONE_DAY),
            PatternRule.constant(REMIND + "\\b", ReminderOffset.EXACT)
    );

    private ReminderPatterns() {
    }

    private static ReminderOffset bucket(String minutes) {
        try {
            return ReminderOffset.forMinutes(Integer.parseInt(minutes));
        } catch (NumberFormatException e) {
            log.debug("Failed to parse reminder minutes: {}", e.getMessage());
            return null;
        }
    }
}
