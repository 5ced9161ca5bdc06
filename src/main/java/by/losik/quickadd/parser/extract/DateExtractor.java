package by.losik.quickadd.parser.extract;

import by.losik.quickadd.parser.table.DatePatterns;
import by.losik.quickadd.parser.table.PatternTable;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Date table lookup that also swallows a "due" or "by" directly in front of the phrase,
 * so "report due friday" leaves just "report".
 */
public final class DateExtractor implements StageExtractor<LocalDateTime> {

    private static final Pattern DUE_OR_BY_SUFFIX = Pattern.compile("\\b(?:due|by)$", Pattern.CASE_INSENSITIVE);

    private final PatternTable<LocalDateTime> table;

    public DateExtractor() {
        this(DatePatterns.TABLE);
    }

    DateExtractor(PatternTable<LocalDateTime> table) {
        this.table = table;
    }

    @Override
    public Optional<StageMatch<LocalDateTime>> extract(String buffer, LocalDateTime now) {
        return table.extract(buffer, now).map(match -> withPrefix(buffer, match));
    }

    private StageMatch<LocalDateTime> withPrefix(String buffer, StageMatch<LocalDateTime> match) {
        StageMatch.Span date = match.spans().get(0);
        String before = buffer.substring(0, date.start()).stripTrailing();
        Matcher prefix = DUE_OR_BY_SUFFIX.matcher(before);
        if (!prefix.find()) {
            return match;
        }
        return StageMatch.of(match.value(),
                new StageMatch.Span(prefix.start(), date.end(), buffer.substring(prefix.start(), date.end())));
    }
}
