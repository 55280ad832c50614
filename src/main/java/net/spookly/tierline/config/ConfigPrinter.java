package net.spookly.tierline.config;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.yaml.snakeyaml.Yaml;

/**
 * Renders the effective configuration with the bid API key redacted.
 */
public final class ConfigPrinter {
    private static final String REDACTED = "<redacted>";
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigPrinter() {
    }

    @SuppressWarnings("unchecked")
    public static String toYaml(TierlineConfig config) {
        Map<String, Object> data = MAPPER.convertValue(config, Map.class);
        Object bid = data == null ? null : data.get("bid");
        if (bid instanceof Map) {
            Map<String, Object> bidMap = (Map<String, Object>) bid;
            if (bidMap.get("apiKey") != null) {
                bidMap.put("apiKey", REDACTED);
            }
        }
        Yaml yaml = new Yaml();
        return yaml.dump(data);
    }
}
