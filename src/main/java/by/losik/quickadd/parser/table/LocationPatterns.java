package by.losik.quickadd.parser.table;

import java.time.LocalDateTime;
import java.util.regex.MatchResult;

/**
 * Best-effort location capture: a known kind of venue after "at", or a capitalized phrase
 * after a lowercase "at". The second rule will also take ordinary capitalized words
 * ("at Noon"); that loss of precision is accepted.
 */
public final class LocationPatterns {

    public static final PatternTable<String> TABLE = new PatternTable<String>("location",
            PatternRule.of("\\bat\\s+(?:the\\s+)?(office|home|work|gym|school|store|market|mall|hospital|clinic"
                    + "|bank|library|cafe|restaurant|airport|station)\\b", LocationPatterns::place),
            PatternRule.caseSensitive("\\bat\\s+([A-Z][a-zA-Z']+(?:\\s+[A-Z][a-zA-Z']+)*)\\b",
                    LocationPatterns::place)
    );

    private LocationPatterns() {
    }

    private static String place(MatchResult m, LocalDateTime now) {
        String place = m.group(1).trim();
        return place.length() > 1 ? place : null;
    }
}
