package net.spookly.tierline.config;

import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Collects non-fatal configuration warnings (unknown timezones, missing ZIP lists).
 */
public final class ConfigWarnings {
    private ConfigWarnings() {
    }

    public static List<String> collect(TierlineConfig config) {
        List<String> warnings = new ArrayList<>();
        if (config == null) {
            return warnings;
        }
        if (config.tiers != null) {
            for (Map.Entry<String, TierlineConfig.TierConfigEntry> entry : config.tiers.entrySet()) {
                TierlineConfig.TierConfigEntry tier = entry.getValue();
                if (tier == null || tier.businessHours == null) {
                    continue;
                }
                warnIfUnknownZone(warnings,
                        "tiers." + entry.getKey() + ".businessHours.timezone",
                        tier.businessHours.timezone,
                        "tier stays open around the clock");
            }
        }
        if (config.history != null) {
            warnIfUnknownZone(warnings,
                    "history.reportingTimezone",
                    config.history.reportingTimezone,
                    "hourly analytics fall back to UTC");
        }
        if (config.zips != null && config.zips.sources != null) {
            for (Map.Entry<String, String> entry : config.zips.sources.entrySet()) {
                warnIfMissingFile(warnings, "zips.sources." + entry.getKey(), entry.getValue());
            }
        }
        return warnings;
    }

    private static void warnIfUnknownZone(List<String> warnings, String label, String value, String consequence) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        try {
            ZoneId.of(value.trim());
        } catch (DateTimeException e) {
            warnings.add(label + " is not a known timezone (" + value.trim() + "); " + consequence);
        }
    }

    private static void warnIfMissingFile(List<String> warnings, String label, String value) {
        if (value == null || value.trim().isEmpty()) {
            return;
        }
        Path path;
        try {
            path = Paths.get(value.trim());
        } catch (InvalidPathException e) {
            warnings.add(label + " is not a valid path: " + value);
            return;
        }
        if (!Files.isRegularFile(path)) {
            warnings.add(label + " does not exist yet: " + path);
        }
    }
}
