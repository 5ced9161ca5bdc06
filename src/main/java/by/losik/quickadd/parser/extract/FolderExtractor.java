package by.losik.quickadd.parser.extract;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks the first {@code @folder} or {@code @"multi word folder"} token.
 */
public final class FolderExtractor implements StageExtractor<String> {

    public static final Pattern QUOTED_FOLDER = Pattern.compile("@\"([^\"]+)\"");
    public static final Pattern SIMPLE_FOLDER = Pattern.compile("@(\\w[\\w-]*)");

    @Override
    public Optional<StageMatch<String>> extract(String buffer, LocalDateTime now) {
        Matcher matcher = QUOTED_FOLDER.matcher(buffer);
        if (matcher.find()) {
            return Optional.of(StageMatch.of(matcher.group(1), matcher));
        }
        matcher = SIMPLE_FOLDER.matcher(buffer);
        if (matcher.find()) {
            return Optional.of(StageMatch.of(matcher.group(1), matcher));
        }
        return Optional.empty();
    }
}
