package by.losik.quickadd.parser.extract;

import java.util.List;
import java.util.regex.MatchResult;

/**
 * Value produced by one extraction stage together with the text regions it consumed.
 *
 * @param value interpreted value
 * @param spans consumed regions, positioned in the text the stage was run against
 */
public record StageMatch<T>(T value, List<Span> spans) {

    /**
     * One consumed region: {@code text} occupies {@code [start, end)} of the scanned text.
     */
    public record Span(int start, int end, String text) {

        public static Span of(MatchResult match) {
            return new Span(match.start(), match.end(), match.group());
        }
    }

    public StageMatch {
        spans = List.copyOf(spans);
    }

    public static <T> StageMatch<T> of(T value, MatchResult match) {
        return new StageMatch<>(value, List.of(Span.of(match)));
    }

    public static <T> StageMatch<T> of(T value, Span span) {
        return new StageMatch<>(value, List.of(span));
    }

    /** Text of the first consumed span; most stages consume exactly one. */
    public String span() {
        return spans.isEmpty() ? "" : spans.get(0).text();
    }

    public List<String> texts() {
        return spans.stream().map(Span::text).toList();
    }
}
