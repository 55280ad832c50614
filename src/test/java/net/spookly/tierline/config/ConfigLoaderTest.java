package net.spookly.tierline.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;
import org.junit.jupiter.api.Test;

class ConfigLoaderTest {
    @Test
    void createsDefaultConfigWhenMissing() throws IOException {
        Path tempDir = Files.createTempDirectory("tierline-config");
        Path configPath = tempDir.resolve("tierline.yaml");

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(Files.exists(configPath));
        String content = Files.readString(configPath, StandardCharsets.UTF_8);
        assertTrue(content.contains("tiers:"));
        assertTrue(content.contains("env:MARKETCALL_API_KEY"));
        assertTrue(exception.getMessage().contains("generated default"));
    }

    @Test
    void loadsTiersAndResolvesPathsRelativeToConfig() throws IOException {
        Path tempDir = Files.createTempDirectory("tierline-config");
        Path configPath = tempDir.resolve("tierline.yaml");
        Path secretPath = tempDir.resolve("secret").resolve("api_key");
        Files.createDirectories(secretPath.getParent());
        Files.writeString(secretPath, "test-key\n", StandardCharsets.UTF_8);
        Files.writeString(configPath, ConfigFixtures.VALID_YAML, StandardCharsets.UTF_8);

        TierlineConfig config = ConfigLoader.load(configPath);

        assertEquals("test-key", config.bid.apiKey);
        assertEquals(tempDir.resolve("data").resolve("tier_1.csv").toString(), config.zips.sources.get("tier_1"));
        TierRegistry registry = TierRegistry.fromConfig(config);
        assertEquals(List.of(TierId.TIER_1, TierId.TIER_2), List.copyOf(registry.tierIds()));
        assertEquals(TierId.TIER_2, registry.get(TierId.TIER_1).fallbackTier());
        assertEquals("11558", registry.get(TierId.TIER_1).offerId());
    }

    @Test
    void rejectsUnknownKeys() throws IOException {
        Path tempDir = Files.createTempDirectory("tierline-config");
        Path configPath = tempDir.resolve("tierline.yaml");
        Files.writeString(configPath, "server:\n  host: 127.0.0.1\n  port: 5000\n  colour: blue\n",
                StandardCharsets.UTF_8);

        ConfigException exception = assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));

        assertTrue(exception.getMessage().contains("Failed to parse config"));
    }

    @Test
    void rejectsEmptyFile() throws IOException {
        Path tempDir = Files.createTempDirectory("tierline-config");
        Path configPath = tempDir.resolve("tierline.yaml");
        Files.writeString(configPath, "", StandardCharsets.UTF_8);

        assertThrows(ConfigException.class, () -> ConfigLoader.load(configPath));
    }

    @Test
    void expandsEnvironmentReferences() {
        Object expanded = EnvExpander.expand(Map.of("apiKey", "env:MARKETCALL_API_KEY"), null,
                name -> "MARKETCALL_API_KEY".equals(name) ? "from-env" : null);

        assertEquals(Map.of("apiKey", "from-env"), expanded);
    }

    @Test
    void missingEnvironmentVariableFailsLoad() {
        ConfigException exception = assertThrows(ConfigException.class,
                () -> EnvExpander.expand(List.of("env:NOT_SET"), null, name -> null));

        assertTrue(exception.getMessage().contains("NOT_SET"));
    }
}
