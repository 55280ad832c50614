package net.spookly.tierline.outcome;

import java.util.Map;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.tier.TierId;

/**
 * Point-in-time copy of the running call analytics.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class AnalyticsSnapshot {
    private final long total;
    private final long success;
    /**
     * Routed calls whose bid failed ({@code api_error} or {@code exception}).
     */
    private final long failure;
    /**
     * Calls whose ZIP no tier owns.
     */
    private final long unrouted;
    private final long fallbackCount;
    private final long totalResponseTimeMs;
    private final int historySize;
    private final Map<CallStatus, Long> byStatus;
    /**
     * Counts keyed by the tier each call was routed to.
     */
    private final Map<TierId, Long> byTier;
    /**
     * Counts keyed by hour of day (0-23) in the reporting timezone.
     */
    private final Map<Integer, Long> byHour;
    private final Map<String, Long> byZip;

    public double averageResponseTimeMs() {
        if (total == 0) {
            return 0D;
        }
        return (double) totalResponseTimeMs / total;
    }

    public double successRate() {
        long routed = success + failure;
        if (routed == 0) {
            return 0D;
        }
        return (double) success / routed;
    }
}
