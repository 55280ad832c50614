package net.spookly.tierline.tier;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Static routing settings for one tier.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class TierConfig {
    private final TierId tierId;
    private final String offerId;
    private final BusinessHours businessHours;
    private final int maxCallsPerHour;
    /**
     * Next tier tried when this one is closed or saturated, or null at the end of a chain.
     */
    private final TierId fallbackTier;
}
