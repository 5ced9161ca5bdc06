package by.losik.quickadd.composition.root;

import by.losik.quickadd.config.ParserConfig;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;

import java.time.Clock;
import java.util.Optional;

public class CompositionRoot extends AbstractModule {

    @Override
    protected void configure() {
    }

    @Provides
    @Singleton
    private ParserConfig createParserConfig() {
        String timezone = Optional.ofNullable(System.getenv("QUICKADD_TIMEZONE"))
                .or(() -> Optional.ofNullable(System.getProperty("quickadd.timezone")))
                .orElse("");

        String outputJson = Optional.ofNullable(System.getenv("QUICKADD_OUTPUT_JSON"))
                .or(() -> Optional.ofNullable(System.getProperty("quickadd.output.json")))
                .orElse("true");

        String detectionGate = Optional.ofNullable(System.getenv("QUICKADD_DETECTION_GATE"))
                .or(() -> Optional.ofNullable(System.getProperty("quickadd.detection.gate")))
                .orElse("true");

        return new ParserConfig(timezone, Boolean.parseBoolean(outputJson), Boolean.parseBoolean(detectionGate));
    }

    @Provides
    @Singleton
    private Clock createClock(ParserConfig config) {
        return Clock.system(config.getZoneId());
    }

    @Provides
    @Singleton
    private ObjectMapper createObjectMapper() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
