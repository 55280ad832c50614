package net.spookly.tierline.tier;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

import net.spookly.tierline.config.ConfigException;
import net.spookly.tierline.config.TierlineConfig;

/**
 * Read-only tier settings loaded once at startup.
 */
public final class TierRegistry {
    private final Map<TierId, TierConfig> tiers;

    /**
     * Build a registry, rejecting inverted hours, dangling fallbacks and fallback cycles.
     */
    public TierRegistry(Collection<TierConfig> configs) {
        Objects.requireNonNull(configs, "configs");
        Map<TierId, TierConfig> byId = new EnumMap<>(TierId.class);
        for (TierConfig config : configs) {
            Objects.requireNonNull(config, "tier config");
            if (byId.putIfAbsent(config.tierId(), config) != null) {
                throw new ConfigException("duplicate tier config: " + config.tierId());
            }
        }
        Map<TierId, TierId> fallbacks = new EnumMap<>(TierId.class);
        for (TierConfig config : byId.values()) {
            BusinessHours hours = config.businessHours();
            if (hours == null || hours.startHour() >= hours.endHour()) {
                throw new ConfigException("tier " + config.tierId() + " business hours must satisfy startHour < endHour");
            }
            if (config.maxCallsPerHour() <= 0) {
                throw new ConfigException("tier " + config.tierId() + " maxCallsPerHour must be greater than 0");
            }
            TierId fallback = config.fallbackTier();
            if (fallback == null) {
                continue;
            }
            if (!byId.containsKey(fallback)) {
                throw new ConfigException("tier " + config.tierId() + " falls back to unconfigured tier " + fallback);
            }
            fallbacks.put(config.tierId(), fallback);
        }
        Optional<List<TierId>> cycle = findCycle(fallbacks);
        if (cycle.isPresent()) {
            throw new ConfigException("fallback chain must be acyclic: " + describe(cycle.get()));
        }
        this.tiers = Collections.unmodifiableMap(byId);
    }

    /**
     * Build a registry from an already validated config.
     */
    public static TierRegistry fromConfig(TierlineConfig config) {
        Objects.requireNonNull(config, "config");
        if (config.tiers == null || config.tiers.isEmpty()) {
            throw new ConfigException("tiers must include at least one tier");
        }
        List<TierConfig> configs = new ArrayList<>();
        for (Map.Entry<String, TierlineConfig.TierConfigEntry> entry : config.tiers.entrySet()) {
            TierId tierId = TierId.fromLabel(entry.getKey())
                    .orElseThrow(() -> new ConfigException("unknown tier label: " + entry.getKey()));
            TierlineConfig.TierConfigEntry tier = entry.getValue();
            TierlineConfig.BusinessHoursConfig hours = tier.businessHours;
            TierId fallback = null;
            if (tier.fallback != null && !tier.fallback.isBlank()) {
                fallback = TierId.fromLabel(tier.fallback)
                        .orElseThrow(() -> new ConfigException("unknown fallback tier: " + tier.fallback));
            }
            configs.add(new TierConfig(
                    tierId,
                    tier.offerId.trim(),
                    new BusinessHours(hours.startHour, hours.endHour, hours.timezone.trim()),
                    tier.maxCallsPerHour,
                    fallback
            ));
        }
        return new TierRegistry(configs);
    }

    public Optional<TierConfig> find(TierId tierId) {
        if (tierId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tiers.get(tierId));
    }

    /**
     * Config for a tier that must exist.
     */
    public TierConfig get(TierId tierId) {
        TierConfig config = tierId == null ? null : tiers.get(tierId);
        if (config == null) {
            throw new IllegalArgumentException("tier not configured: " + tierId);
        }
        return config;
    }

    public boolean contains(TierId tierId) {
        return tierId != null && tiers.containsKey(tierId);
    }

    /**
     * Configured tiers in priority order.
     */
    public Set<TierId> tierIds() {
        return tiers.keySet();
    }

    /**
     * First fallback cycle found in a tier-to-fallback mapping, listed from its entry tier.
     */
    public static Optional<List<TierId>> findCycle(Map<TierId, TierId> fallbacks) {
        for (TierId start : fallbacks.keySet()) {
            Set<TierId> path = new LinkedHashSet<>();
            TierId current = start;
            while (current != null) {
                if (!path.add(current)) {
                    List<TierId> cycle = new ArrayList<>();
                    boolean inCycle = false;
                    for (TierId step : path) {
                        if (step == current) {
                            inCycle = true;
                        }
                        if (inCycle) {
                            cycle.add(step);
                        }
                    }
                    cycle.add(current);
                    return Optional.of(cycle);
                }
                current = fallbacks.get(current);
            }
        }
        return Optional.empty();
    }

    private static String describe(List<TierId> cycle) {
        StringBuilder builder = new StringBuilder();
        for (TierId tier : cycle) {
            if (builder.length() > 0) {
                builder.append(" -> ");
            }
            builder.append(tier.label());
        }
        return builder.toString();
    }
}
