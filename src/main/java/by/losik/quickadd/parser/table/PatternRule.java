package by.losik.quickadd.parser.table;

import java.time.LocalDateTime;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * One trigger pattern and the interpreter that turns its match into a value.
 */
public record PatternRule<T>(Pattern trigger, Interpreter<T> interpreter) {

    /**
     * Turns a match into a value. Returning {@code null} declines the match, and the
     * table moves on to its next rule.
     */
    @FunctionalInterface
    public interface Interpreter<T> {
        T interpret(MatchResult match, LocalDateTime now);
    }

    public static <T> PatternRule<T> of(String regex, Interpreter<T> interpreter) {
        return new PatternRule<>(Pattern.compile(regex, Pattern.CASE_INSENSITIVE), interpreter);
    }

    public static <T> PatternRule<T> caseSensitive(String regex, Interpreter<T> interpreter) {
        return new PatternRule<>(Pattern.compile(regex), interpreter);
    }

    public static <T> PatternRule<T> constant(String regex, T value) {
        return of(regex, (match, now) -> value);
    }
}
