package net.spookly.tierline.routing;

import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

import net.spookly.tierline.tier.BusinessHours;
import net.spookly.tierline.tier.TierConfig;
import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Tests whether a tier is inside its business-hours window at a given instant.
 *
 * <p>A timezone that cannot be resolved keeps the tier open and counts as a degraded condition.
 */
public final class BusinessHoursGate {
    private final TierRegistry registry;
    private final Map<String, Optional<ZoneId>> zones = new ConcurrentHashMap<>();
    private final AtomicLong failOpenCount = new AtomicLong();

    public BusinessHoursGate(TierRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public boolean isOpen(TierId tier, Instant now) {
        TierConfig config = registry.get(tier);
        BusinessHours hours = config.businessHours();
        Optional<ZoneId> zone = resolveZone(hours.timezone());
        if (zone.isEmpty()) {
            failOpenCount.incrementAndGet();
            return true;
        }
        int localHour = now.atZone(zone.get()).getHour();
        return hours.contains(localHour);
    }

    /**
     * Number of checks answered open because the tier's timezone could not be resolved.
     */
    public long failOpenCount() {
        return failOpenCount.get();
    }

    private Optional<ZoneId> resolveZone(String timezone) {
        if (timezone == null) {
            return Optional.empty();
        }
        return zones.computeIfAbsent(timezone, id -> {
            try {
                return Optional.of(ZoneId.of(id));
            } catch (DateTimeException e) {
                System.err.println("Business hours degraded: unknown timezone '" + id
                        + "', tiers using it stay open");
                return Optional.empty();
            }
        });
    }
}
