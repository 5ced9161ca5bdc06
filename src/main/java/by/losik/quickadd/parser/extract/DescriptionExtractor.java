package by.losik.quickadd.parser.extract;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a trailing {@code " // notes"}, {@code " -- notes"} or {@code " | notes"} off the line.
 */
public final class DescriptionExtractor implements StageExtractor<String> {

    public static final Pattern TRAILING_DESCRIPTION = Pattern.compile("\\s+(?://|--|\\|)\\s+(.+)$");

    @Override
    public Optional<StageMatch<String>> extract(String buffer, LocalDateTime now) {
        Matcher matcher = TRAILING_DESCRIPTION.matcher(buffer);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(StageMatch.of(matcher.group(1).trim(), matcher));
    }
}
