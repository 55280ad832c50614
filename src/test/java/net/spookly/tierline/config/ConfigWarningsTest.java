package net.spookly.tierline.config;

import static net.spookly.tierline.config.ConfigFixtures.validConfig;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

class ConfigWarningsTest {
    @Test
    void warnsOnUnknownTimezones() throws IOException {
        TierlineConfig config = withExistingSources(validConfig());
        config.tiers.get("tier_2").businessHours.timezone = "Mars/Olympus";
        config.history = new TierlineConfig.HistoryConfig();
        config.history.reportingTimezone = "Nowhere/Else";

        List<String> warnings = ConfigWarnings.collect(config);

        assertEquals(2, warnings.size());
        assertTrue(warnings.get(0).contains("tiers.tier_2.businessHours.timezone"));
        assertTrue(warnings.get(1).contains("history.reportingTimezone"));
    }

    @Test
    void warnsOnMissingZipList() {
        TierlineConfig config = validConfig();
        config.zips.sources = Map.of("tier_1", "/nonexistent/tierline/tier_1.csv");

        List<String> warnings = ConfigWarnings.collect(config);

        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).contains("zips.sources.tier_1"));
    }

    @Test
    void validConfigHasNoWarnings() throws IOException {
        assertTrue(ConfigWarnings.collect(withExistingSources(validConfig())).isEmpty());
    }

    private static TierlineConfig withExistingSources(TierlineConfig config) throws IOException {
        Path file = Files.createTempFile("tierline-zips", ".csv");
        config.zips.sources = Map.of("tier_1", file.toString());
        return config;
    }
}
