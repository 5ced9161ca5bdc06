package by.losik.quickadd.parser.extract;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects {@code #tag} and {@code #"multi word tag"} tokens. Quoted tags go first; a bare
 * tag starting inside a quoted one is skipped.
 */
public final class TagExtractor implements StageExtractor<List<String>> {

    public static final Pattern QUOTED_TAG = Pattern.compile("#\"([^\"]+)\"");
    public static final Pattern SIMPLE_TAG = Pattern.compile("#(\\w[\\w-]*)");

    @Override
    public Optional<StageMatch<List<String>>> extract(String buffer, LocalDateTime now) {
        List<String> tags = new ArrayList<>();
        List<StageMatch.Span> spans = new ArrayList<>();

        Matcher quoted = QUOTED_TAG.matcher(buffer);
        while (quoted.find()) {
            tags.add(quoted.group(1));
            spans.add(StageMatch.Span.of(quoted));
        }
        List<StageMatch.Span> quotedSpans = List.copyOf(spans);

        Matcher simple = SIMPLE_TAG.matcher(buffer);
        while (simple.find()) {
            if (insideAny(simple.start(), quotedSpans)) {
                continue;
            }
            tags.add(simple.group(1));
            spans.add(StageMatch.Span.of(simple));
        }

        if (tags.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new StageMatch<>(List.copyOf(tags), spans));
    }

    private static boolean insideAny(int position, List<StageMatch.Span> spans) {
        return spans.stream().anyMatch(span -> position >= span.start() && position < span.end());
    }
}
