package by.losik.quickadd.parser.table;

import by.losik.quickadd.dto.Priority;

/**
 * Priority words and shorthand. The cues are alternate spellings of the same thing; the
 * first rule that matches decides, with no weighing between competing cues.
 */
public final class PriorityPatterns {

    public static final PatternTable<Priority> TABLE = new PatternTable<Priority>("priority",
            PatternRule.constant("\\b(high priority|urgent|important|asap|critical|!{2,})\\b", Priority.HIGH),
            PatternRule.constant("\\b(medium priority|normal|moderate)\\b", Priority.MEDIUM),
            PatternRule.constant("\\b(low priority|later|whenever|someday)\\b", Priority.LOW),
            PatternRule.constant("!{3,}", Priority.HIGH),
            PatternRule.constant("!!", Priority.MEDIUM),
            PatternRule.constant("\\bp1\\b", Priority.HIGH),
            PatternRule.constant("\\bp2\\b", Priority.MEDIUM),
            PatternRule.constant("\\bp3\\b", Priority.LOW),
            PatternRule.constant("!high\\b", Priority.HIGH),
            PatternRule.constant("!med(?:ium)?\\b", Priority.MEDIUM),
            PatternRule.constant("!low\\b", Priority.LOW),
            PatternRule.constant("\\*{2,}", Priority.HIGH),
            PatternRule.constant("\\*(?!\\*)", Priority.MEDIUM)
    );

    private PriorityPatterns() {
    }
}
