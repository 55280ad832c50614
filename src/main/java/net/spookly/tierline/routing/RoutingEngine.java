package net.spookly.tierline.routing;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Routes a call event: ZIP lookup, then the fallback walk over business hours and hourly caps.
 */
public final class RoutingEngine {
    private final TierRegistry registry;
    private final RoutingEngineState state;
    private final BusinessHoursGate hoursGate;
    private final FallbackResolver resolver;

    public RoutingEngine(TierRegistry registry, RoutingEngineState state) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.state = Objects.requireNonNull(state, "state");
        this.hoursGate = new BusinessHoursGate(registry);
        this.resolver = new FallbackResolver(registry, hoursGate, state.rateLimiter());
    }

    /**
     * Decide the tier for a call. Unknown ZIPs return {@link RoutingDecision#unrouted()}.
     *
     * @param callerId caller identity, carried by the caller into the call record
     */
    public RoutingDecision routeCall(String zip, String callerId, Instant now) {
        Objects.requireNonNull(now, "now");
        Optional<TierId> originalTier = state.zipDirectory().lookup(zip);
        if (originalTier.isEmpty() || !registry.contains(originalTier.get())) {
            return RoutingDecision.unrouted();
        }
        TierId tier = originalTier.get();
        Resolution resolution = resolver.resolve(tier, now);
        String offerId = registry.get(resolution.chosenTier()).offerId();
        return RoutingDecision.routed(tier, resolution, offerId);
    }

    public RoutingEngineState state() {
        return state;
    }

    public TierRegistry registry() {
        return registry;
    }

    /**
     * Checks answered open because a tier's timezone could not be resolved.
     */
    public long businessHoursFailOpenCount() {
        return hoursGate.failOpenCount();
    }
}
