package net.spookly.tierline.routing;

import java.util.Objects;

import lombok.Getter;
import lombok.experimental.Accessors;
import net.spookly.tierline.outcome.OutcomeRecorder;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Mutable routing state owned by one service instance: the ZIP snapshot holder, the hourly
 * counters and the call history.
 */
@Getter
@Accessors(fluent = true)
public final class RoutingEngineState {
    private final ZipDirectory zipDirectory;
    private final HourlyRateLimiter rateLimiter;
    private final OutcomeRecorder outcomeRecorder;

    public RoutingEngineState(ZipDirectory zipDirectory, HourlyRateLimiter rateLimiter, OutcomeRecorder outcomeRecorder) {
        this.zipDirectory = Objects.requireNonNull(zipDirectory, "zipDirectory");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.outcomeRecorder = Objects.requireNonNull(outcomeRecorder, "outcomeRecorder");
    }

    /**
     * Fresh state with an empty ZIP index, zeroed counters and default history capacity.
     */
    public static RoutingEngineState fresh(TierRegistry registry) {
        return new RoutingEngineState(new ZipDirectory(), new HourlyRateLimiter(registry), new OutcomeRecorder());
    }
}
