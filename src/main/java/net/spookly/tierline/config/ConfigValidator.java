package net.spookly.tierline.config;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;

public final class ConfigValidator {
    private ConfigValidator() {
    }

    /**
     * Validate configuration, throwing ConfigException on any violations.
     */
    public static void validate(TierlineConfig config) {
        List<String> errors = new ArrayList<>();
        if (config == null) {
            errors.add("config is required");
            throwIfErrors(errors);
            return;
        }

        validateServer(config, errors);
        validateBid(config, errors);
        validateTiers(config, errors);
        validateZips(config, errors);
        validateHistory(config, errors);

        throwIfErrors(errors);
    }

    private static void validateServer(TierlineConfig config, List<String> errors) {
        TierlineConfig.ServerConfig server = config.server;
        if (server == null) {
            errors.add("server section is required");
            return;
        }
        requireNonBlank(errors, server.host, "server.host");
        requirePort(errors, server.port, "server.port");
        requirePositiveIfSet(errors, server.maxRequestBytes, "server.maxRequestBytes");
        requirePositiveIfSet(errors, server.maxHistoryResults, "server.maxHistoryResults");
        requirePositiveIfSet(errors, server.workerThreads, "server.workerThreads");
    }

    private static void validateBid(TierlineConfig config, List<String> errors) {
        TierlineConfig.BidConfig bid = config.bid;
        if (bid == null) {
            errors.add("bid section is required");
            return;
        }
        requireNonBlank(errors, bid.baseUrl, "bid.baseUrl");
        if (!isBlank(bid.baseUrl) && !isHttpUrl(bid.baseUrl)) {
            errors.add("bid.baseUrl must be an http or https URL");
        }
        requireNonBlank(errors, bid.apiKey, "bid.apiKey");
        requireNonBlank(errors, bid.campaignId, "bid.campaignId");
        requirePositive(errors, bid.timeoutMs, "bid.timeoutMs");
    }

    private static void validateTiers(TierlineConfig config, List<String> errors) {
        if (config.tiers == null || config.tiers.isEmpty()) {
            errors.add("tiers must include at least one tier");
            return;
        }
        Map<TierId, String> labels = new EnumMap<>(TierId.class);
        for (String label : config.tiers.keySet()) {
            Optional<TierId> tierId = TierId.fromLabel(label);
            if (tierId.isEmpty()) {
                errors.add("tiers." + label + " is not a known tier (expected tier_1, tier_2 or tier_3)");
                continue;
            }
            String previous = labels.putIfAbsent(tierId.get(), label);
            if (previous != null) {
                errors.add("tiers." + label + " duplicates tiers." + previous);
            }
        }

        Map<TierId, TierId> fallbacks = new EnumMap<>(TierId.class);
        for (Map.Entry<String, TierlineConfig.TierConfigEntry> entry : config.tiers.entrySet()) {
            String label = entry.getKey();
            String prefix = "tiers." + label;
            TierlineConfig.TierConfigEntry tier = entry.getValue();
            if (tier == null) {
                errors.add(prefix + " is required");
                continue;
            }
            requireNonBlank(errors, tier.offerId, prefix + ".offerId");
            requirePositive(errors, tier.maxCallsPerHour, prefix + ".maxCallsPerHour");
            validateBusinessHours(tier.businessHours, prefix + ".businessHours", errors);

            if (isBlank(tier.fallback)) {
                continue;
            }
            Optional<TierId> self = TierId.fromLabel(label);
            Optional<TierId> fallback = TierId.fromLabel(tier.fallback);
            if (fallback.isEmpty()) {
                errors.add(prefix + ".fallback is not a known tier: " + tier.fallback);
                continue;
            }
            if (!labels.containsKey(fallback.get())) {
                errors.add(prefix + ".fallback must reference a configured tier: " + tier.fallback);
                continue;
            }
            if (self.isPresent()) {
                fallbacks.put(self.get(), fallback.get());
            }
        }
        TierRegistry.findCycle(fallbacks).ifPresent(cycle ->
                errors.add("tiers fallback chain must be acyclic: " + cycle));
    }

    private static void validateBusinessHours(TierlineConfig.BusinessHoursConfig hours,
                                              String prefix,
                                              List<String> errors) {
        if (hours == null) {
            errors.add(prefix + " is required");
            return;
        }
        requireHour(errors, hours.startHour, prefix + ".startHour");
        requireHour(errors, hours.endHour, prefix + ".endHour");
        if (hours.startHour != null && hours.endHour != null && hours.startHour >= hours.endHour) {
            errors.add(prefix + " must satisfy startHour < endHour (windows may not span midnight)");
        }
        requireNonBlank(errors, hours.timezone, prefix + ".timezone");
    }

    private static void validateZips(TierlineConfig config, List<String> errors) {
        TierlineConfig.ZipsConfig zips = config.zips;
        if (zips == null) {
            errors.add("zips section is required");
            return;
        }
        if (zips.sources == null || zips.sources.isEmpty()) {
            errors.add("zips.sources must include at least one tier source");
        } else {
            for (Map.Entry<String, String> entry : zips.sources.entrySet()) {
                String label = entry.getKey();
                Optional<TierId> tierId = TierId.fromLabel(label);
                if (tierId.isEmpty()) {
                    errors.add("zips.sources." + label + " is not a known tier");
                } else if (config.tiers != null && config.tiers.keySet().stream()
                        .map(TierId::fromLabel)
                        .noneMatch(configured -> configured.equals(tierId))) {
                    errors.add("zips.sources." + label + " must reference a configured tier");
                }
                requireNonBlank(errors, entry.getValue(), "zips.sources." + label);
            }
        }
        requirePositiveIfSet(errors, zips.reloadIntervalSeconds, "zips.reloadIntervalSeconds");
    }

    private static void validateHistory(TierlineConfig config, List<String> errors) {
        TierlineConfig.HistoryConfig history = config.history;
        if (history == null) {
            return;
        }
        requirePositiveIfSet(errors, history.capacity, "history.capacity");
    }

    private static boolean isHttpUrl(String value) {
        try {
            URI uri = new URI(value.trim());
            String scheme = uri.getScheme();
            return uri.getHost() != null
                    && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static void requireNonBlank(List<String> errors, String value, String field) {
        if (isBlank(value)) {
            errors.add(field + " is required");
        }
    }

    private static void requirePort(List<String> errors, Integer value, String field) {
        if (value == null || value < 1 || value > 65535) {
            errors.add(field + " must be between 1 and 65535");
        }
    }

    private static void requireHour(List<String> errors, Integer value, String field) {
        if (value == null || value < 0 || value > 23) {
            errors.add(field + " must be between 0 and 23");
        }
    }

    private static void requirePositive(List<String> errors, Integer value, String field) {
        if (value == null || value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static void requirePositiveIfSet(List<String> errors, Integer value, String field) {
        if (value != null && value <= 0) {
            errors.add(field + " must be greater than 0");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    private static void throwIfErrors(List<String> errors) {
        if (!errors.isEmpty()) {
            StringBuilder builder = new StringBuilder("Invalid config:\n");
            for (String error : errors) {
                builder.append("- ").append(error).append('\n');
            }
            throw new ConfigException(builder.toString());
        }
    }
}
