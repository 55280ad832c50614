package net.spookly.tierline.outcome;

import java.time.Instant;

import lombok.Builder;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.tier.TierId;

/**
 * Immutable audit entry for one inbound call event.
 */
@Getter
@Accessors(fluent = true)
@Builder(toBuilder = true)
public final class CallRecord {
    private final Instant timestamp;
    private final String callerId;
    private final String zipCode;
    /**
     * Tier owning the ZIP, or null when no tier does.
     */
    private final TierId originalTier;
    /**
     * Tier the call was routed to, or null when unrouted.
     */
    private final TierId chosenTier;
    private final boolean fallbackUsed;
    private final boolean businessHoursOk;
    private final boolean rateLimitOk;
    private final CallStatus status;
    private final long responseTimeMs;
    private final String externalCallId;
}
