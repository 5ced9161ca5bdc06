package by.losik.quickadd.parser.extract;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Effort estimates: {@code ~2h}, {@code ~1.5h}, {@code ~1h30m}, {@code ~45m}, {@code est:2h},
 * {@code effort:30m}. The value is in hours.
 */
public final class EffortExtractor implements StageExtractor<Double> {

    private static final Logger log = LoggerFactory.getLogger(EffortExtractor.class);

    private static final String PREFIX = "(?:~|est(?:imate)?:|effort:)\\s*";

    public static final Pattern HOURS = Pattern.compile(
            PREFIX + "(\\d+(?:\\.\\d+)?)\\s*h(?:ours?|rs?)?\\s*(?:(\\d+)\\s*m(?:in(?:ute)?s?)?)?",
            Pattern.CASE_INSENSITIVE);

    public static final Pattern MINUTES = Pattern.compile(
            PREFIX + "(\\d+)\\s*m(?:in(?:ute)?s?)?",
            Pattern.CASE_INSENSITIVE);

    @Override
    public Optional<StageMatch<Double>> extract(String buffer, LocalDateTime now) {
        try {
            Matcher matcher = HOURS.matcher(buffer);
            if (matcher.find()) {
                double hours = Double.parseDouble(matcher.group(1));
                if (matcher.group(2) != null) {
                    hours += Integer.parseInt(matcher.group(2)) / 60.0;
                }
                return Optional.of(StageMatch.of(hours, matcher));
            }

            matcher = MINUTES.matcher(buffer);
            if (matcher.find()) {
                return Optional.of(StageMatch.of(Integer.parseInt(matcher.group(1)) / 60.0, matcher));
            }
        } catch (NumberFormatException e) {
            log.debug("Failed to parse effort estimate: {}", e.getMessage());
        }
        return Optional.empty();
    }
}
