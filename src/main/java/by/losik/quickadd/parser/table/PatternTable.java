package by.losik.quickadd.parser.table;

import by.losik.quickadd.parser.extract.StageExtractor;
import by.losik.quickadd.parser.extract.StageMatch;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable ordered list of rules for one concern. Earlier rules win: the first rule whose
 * trigger matches and whose interpreter accepts the match produces the result.
 */
public final class PatternTable<T> implements StageExtractor<T> {

    private final String name;
    private final List<PatternRule<T>> rules;

    @SafeVarargs
    public PatternTable(String name, PatternRule<T>... rules) {
        this.name = name;
        this.rules = List.of(rules);
    }

    @Override
    public Optional<StageMatch<T>> extract(String buffer, LocalDateTime now) {
        for (PatternRule<T> rule : rules) {
            Matcher matcher = rule.trigger().matcher(buffer);
            if (!matcher.find()) {
                continue;
            }
            T value = rule.interpreter().interpret(matcher.toMatchResult(), now);
            if (value != null) {
                return Optional.of(StageMatch.of(value, matcher.toMatchResult()));
            }
        }
        return Optional.empty();
    }

    /** Tests the triggers only, without interpreting anything. */
    public boolean matchesAny(String text) {
        for (PatternRule<T> rule : rules) {
            if (rule.trigger().matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    public List<Pattern> triggers() {
        return rules.stream().map(PatternRule::trigger).toList();
    }

    List<PatternRule<T>> rules() {
        return rules;
    }

    String name() {
        return name;
    }

    @Override
    public String toString() {
        return "PatternTable[" + name + ", " + rules.size() + " rules]";
    }
}
