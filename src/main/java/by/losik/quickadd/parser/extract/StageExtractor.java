package by.losik.quickadd.parser.extract;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * One narrow extraction step. Implementations never modify the buffer; removing the
 * consumed spans is up to the caller.
 */
@FunctionalInterface
public interface StageExtractor<T> {

    Optional<StageMatch<T>> extract(String buffer, LocalDateTime now);
}
