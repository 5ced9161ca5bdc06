package by.losik.quickadd.config;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.ZoneId;

class ParserConfigTest {

    @Test
    void constructor_WithValidZone_ShouldUseIt() {
        ParserConfig config = new ParserConfig("Europe/Minsk", false, true);

        Assertions.assertEquals(ZoneId.of("Europe/Minsk"), config.getZoneId());
        Assertions.assertFalse(config.isOutputJson());
        Assertions.assertTrue(config.isDetectionGate());
    }

    @Test
    void constructor_WithPaddedZone_ShouldTrimIt() {
        Assertions.assertEquals(ZoneId.of("UTC"), new ParserConfig(" UTC ", true, true).getZoneId());
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "Mars/Olympus_Mons", "+99:00"})
    void constructor_WithMissingOrInvalidZone_ShouldFallBackToSystemDefault(String timezone) {
        Assertions.assertEquals(ZoneId.systemDefault(), new ParserConfig(timezone, true, false).getZoneId());
    }
}
