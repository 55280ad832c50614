package net.spookly.tierline.routing;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;

/**
 * Per-tier call counters bucketed by UTC clock hour.
 *
 * <p>Buckets are keyed by hours since the epoch, so the same hour of day on different days never
 * shares a counter. Counters only grow; buckets older than the previous hour are pruned on commit.
 */
public final class HourlyRateLimiter {
    private static final long SECONDS_PER_HOUR = 3_600L;

    private final TierRegistry registry;
    private final Map<BucketKey, AtomicInteger> buckets = new ConcurrentHashMap<>();

    public HourlyRateLimiter(TierRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    /**
     * Probe whether one more call fits under the tier's cap without counting it.
     */
    public boolean checkOk(TierId tier, Instant now) {
        return currentCount(tier, now) < capFor(tier);
    }

    /**
     * Count a call only if the tier is still under its cap for the current hour.
     *
     * @return false, without counting, when the cap is already reached
     */
    public boolean tryAcquire(TierId tier, Instant now) {
        int cap = capFor(tier);
        long hour = epochHour(now);
        AtomicInteger counter = buckets.computeIfAbsent(new BucketKey(tier, hour), ignored -> new AtomicInteger());
        while (true) {
            int count = counter.get();
            if (count >= cap) {
                return false;
            }
            if (counter.compareAndSet(count, count + 1)) {
                pruneBefore(hour - 1);
                return true;
            }
        }
    }

    /**
     * Count a call against the tier's current hour regardless of the cap and report whether it
     * stayed within it.
     */
    public boolean recordAndCheck(TierId tier, Instant now) {
        int cap = capFor(tier);
        long hour = epochHour(now);
        AtomicInteger counter = buckets.computeIfAbsent(new BucketKey(tier, hour), ignored -> new AtomicInteger());
        int count = counter.incrementAndGet();
        pruneBefore(hour - 1);
        return count <= cap;
    }

    /**
     * Calls committed for the tier in the clock hour containing {@code now}.
     */
    public int currentCount(TierId tier, Instant now) {
        Objects.requireNonNull(tier, "tier");
        AtomicInteger counter = buckets.get(new BucketKey(tier, epochHour(now)));
        return counter == null ? 0 : counter.get();
    }

    public int capFor(TierId tier) {
        return registry.get(tier).maxCallsPerHour();
    }

    int bucketCount() {
        return buckets.size();
    }

    private void pruneBefore(long oldestKeptHour) {
        buckets.keySet().removeIf(key -> key.epochHour() < oldestKeptHour);
    }

    private static long epochHour(Instant now) {
        Objects.requireNonNull(now, "now");
        return Math.floorDiv(now.getEpochSecond(), SECONDS_PER_HOUR);
    }

    private record BucketKey(TierId tier, long epochHour) {
    }
}
