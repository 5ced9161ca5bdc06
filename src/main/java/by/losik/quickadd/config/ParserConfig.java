package by.losik.quickadd.config;

import com.google.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.ZoneId;

@Singleton
public class ParserConfig {

    private static final Logger log = LoggerFactory.getLogger(ParserConfig.class);

    private final ZoneId zoneId;
    private final boolean outputJson;
    private final boolean detectionGate;

    public ParserConfig(String timezone, boolean outputJson, boolean detectionGate) {
        this.zoneId = resolveZone(timezone);
        this.outputJson = outputJson;
        this.detectionGate = detectionGate;
    }

    private static ZoneId resolveZone(String timezone) {
        if (timezone == null || timezone.isBlank()) {
            return ZoneId.systemDefault();
        }
        try {
            return ZoneId.of(timezone.trim());
        } catch (DateTimeException e) {
            log.warn("Unknown timezone '{}', falling back to {}", timezone, ZoneId.systemDefault());
            return ZoneId.systemDefault();
        }
    }

    public ZoneId getZoneId() { return zoneId; }
    public boolean isOutputJson() { return outputJson; }
    public boolean isDetectionGate() { return detectionGate; }
}
