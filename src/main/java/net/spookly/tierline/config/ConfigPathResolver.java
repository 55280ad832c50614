package net.spookly.tierline.config;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resolves relative ZIP source paths against the config directory.
 */
final class ConfigPathResolver {
    private ConfigPathResolver() {
    }

    static void resolve(TierlineConfig config, Path baseDir) {
        if (config == null || baseDir == null) {
            return;
        }
        TierlineConfig.ZipsConfig zips = config.zips;
        if (zips == null || zips.sources == null) {
            return;
        }
        Map<String, String> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : zips.sources.entrySet()) {
            String rawValue = entry.getValue();
            if (rawValue == null || rawValue.isBlank()) {
                resolved.put(entry.getKey(), rawValue);
                continue;
            }
            resolved.put(entry.getKey(), EnvExpander.resolvePath(baseDir, rawValue.trim()).toString());
        }
        zips.sources = resolved;
    }
}
