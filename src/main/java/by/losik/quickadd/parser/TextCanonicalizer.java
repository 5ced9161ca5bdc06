package by.losik.quickadd.parser;

import java.util.regex.Pattern;

/**
 * Cosmetic cleanup of the leftover title: collapses whitespace, drops stray commas and the
 * connective words ("at", "on", "by", "in", "every", "due", "for") an extraction left dangling.
 */
public final class TextCanonicalizer {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern LEADING_COMMA = Pattern.compile("^\\s*,\\s*");
    private static final Pattern TRAILING_COMMA = Pattern.compile("\\s*,\\s*$");
    private static final Pattern TRAILING_CONNECTIVE =
            Pattern.compile("\\s+(?:at|on|by|in|every|due|for)\\s*$", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_CONNECTIVE =
            Pattern.compile("^(?:at|on|by|in|every|due|for)\\s+", Pattern.CASE_INSENSITIVE);

    /**
     * @param text      leftover buffer
     * @param extracted whether any stage removed text; leading connectives are only
     *                  stripped then, so an untouched title like "For Sale sign" survives
     */
    public String canonicalize(String text, boolean extracted) {
        String result = WHITESPACE.matcher(text).replaceAll(" ");
        String previous;
        do {
            previous = result;
            result = LEADING_COMMA.matcher(result).replaceFirst("");
            result = TRAILING_COMMA.matcher(result).replaceFirst("");
            result = TRAILING_CONNECTIVE.matcher(result).replaceFirst("");
            if (extracted) {
                result = LEADING_CONNECTIVE.matcher(result).replaceFirst("");
            }
            result = result.trim();
        } while (!result.equals(previous));
        return result;
    }
}
