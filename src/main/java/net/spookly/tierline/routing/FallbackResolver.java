package net.spookly.tierline.routing;

import java.time.Instant;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

import net.spookly.tierline.tier.TierConfig;
import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Walks a tier's fallback chain to find one that is open and under its hourly cap.
 *
 * <p>Each open candidate is claimed with a conditional acquire, so concurrent calls never push a
 * tier past its cap while the walk can still move on; rejected candidates are not counted. When every tier in the chain is closed or saturated the original tier is used anyway:
 * a ZIP owned by a tier is never dropped because of its gates.
 */
public final class FallbackResolver {
    private final TierRegistry registry;
    private final BusinessHoursGate hoursGate;
    private final HourlyRateLimiter rateLimiter;

    public FallbackResolver(TierRegistry registry, BusinessHoursGate hoursGate, HourlyRateLimiter rateLimiter) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.hoursGate = Objects.requireNonNull(hoursGate, "hoursGate");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
    }

    public Resolution resolve(TierId originalTier, Instant now) {
        Objects.requireNonNull(originalTier, "originalTier");
        Objects.requireNonNull(now, "now");
        Set<TierId> visited = EnumSet.noneOf(TierId.class);
        TierId candidate = originalTier;
        boolean originalOpen = false;
        while (candidate != null && visited.add(candidate)) {
            boolean open = hoursGate.isOpen(candidate, now);
            if (candidate == originalTier) {
                originalOpen = open;
            }
            if (open && rateLimiter.tryAcquire(candidate, now)) {
                return new Resolution(candidate, candidate != originalTier, true, true);
            }
            TierConfig config = registry.get(candidate);
            candidate = config.fallbackTier();
        }
        boolean withinCap = rateLimiter.recordAndCheck(originalTier, now);
        return new Resolution(originalTier, false, originalOpen, withinCap);
    }
}
