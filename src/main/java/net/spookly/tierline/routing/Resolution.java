package net.spookly.tierline.routing;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.tier.TierId;

/**
 * Tier picked by the fallback walk together with its gate results.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class Resolution {
    private final TierId chosenTier;
    private final boolean fallbackUsed;
    private final boolean businessHoursOk;
    /**
     * Whether the committed call stayed within the chosen tier's hourly cap.
     */
    private final boolean rateLimitOk;
}
