package net.spookly.tierline.routing;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.tier.TierId;

/**
 * Final routing outcome for one call event. Unrouted decisions carry no tiers.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class RoutingDecision {
    private static final RoutingDecision UNROUTED = new RoutingDecision(false, null, null, null, false, false, false);

    private final boolean routed;
    private final TierId chosenTier;
    private final String offerId;
    private final TierId originalTier;
    private final boolean fallbackUsed;
    private final boolean businessHoursOk;
    private final boolean rateLimitOk;

    static RoutingDecision routed(TierId originalTier, Resolution resolution, String offerId) {
        return new RoutingDecision(
                true,
                resolution.chosenTier(),
                offerId,
                originalTier,
                resolution.fallbackUsed(),
                resolution.businessHoursOk(),
                resolution.rateLimitOk()
        );
    }

    /**
     * No tier owns the ZIP; a normal terminal outcome, not an error.
     */
    public static RoutingDecision unrouted() {
        return UNROUTED;
    }
}
