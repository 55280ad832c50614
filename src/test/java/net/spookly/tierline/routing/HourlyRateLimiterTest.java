package net.spookly.tierline.routing;

import static net.spookly.tierline.tier.TierFixtures.registry;
import static net.spookly.tierline.tier.TierFixtures.tier;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import net.spookly.tierline.tier.TierId;
import net.spookly.tierline.tier.TierRegistry;
import org.junit.jupiter.api.Test;

class HourlyRateLimiterTest {
    private static final Instant NOW = Instant.parse("2024-07-15T14:05:00Z");

    @Test
    void probeDoesNotCount() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(1));

        assertTrue(limiter.checkOk(TierId.TIER_1, NOW));
        assertTrue(limiter.checkOk(TierId.TIER_1, NOW));
        assertEquals(0, limiter.currentCount(TierId.TIER_1, NOW));
    }

    @Test
    void repeatedProbesBeforeCommitLeaveSingleCount() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(5));
        for (int i = 0; i < 10; i++) {
            limiter.checkOk(TierId.TIER_1, NOW);
        }

        limiter.recordAndCheck(TierId.TIER_1, NOW);

        assertEquals(1, limiter.currentCount(TierId.TIER_1, NOW));
    }

    @Test
    void capIsReachedAfterCommittedCalls() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(2));

        assertTrue(limiter.recordAndCheck(TierId.TIER_1, NOW));
        assertTrue(limiter.checkOk(TierId.TIER_1, NOW));
        assertTrue(limiter.recordAndCheck(TierId.TIER_1, NOW));
        assertFalse(limiter.checkOk(TierId.TIER_1, NOW));
        assertFalse(limiter.recordAndCheck(TierId.TIER_1, NOW));
        assertEquals(3, limiter.currentCount(TierId.TIER_1, NOW));
    }

    @Test
    void tryAcquireStopsAtCap() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(2));

        assertTrue(limiter.tryAcquire(TierId.TIER_1, NOW));
        assertTrue(limiter.tryAcquire(TierId.TIER_1, NOW));
        assertFalse(limiter.tryAcquire(TierId.TIER_1, NOW));
        assertEquals(2, limiter.currentCount(TierId.TIER_1, NOW));
    }

    @Test
    void concurrentTryAcquireNeverExceedsCap() throws Exception {
        int cap = 5;
        int calls = 64;
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(cap));
        ExecutorService executor = Executors.newFixedThreadPool(16);
        CountDownLatch start = new CountDownLatch(1);
        int granted = 0;
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return limiter.tryAcquire(TierId.TIER_1, NOW);
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                if (result.get(10, TimeUnit.SECONDS)) {
                    granted++;
                }
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(cap, granted);
        assertEquals(cap, limiter.currentCount(TierId.TIER_1, NOW));
    }

    @Test
    void nextHourStartsFromZero() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(1));
        limiter.recordAndCheck(TierId.TIER_1, NOW);

        Instant nextHour = Instant.parse("2024-07-15T15:00:00Z");

        assertEquals(0, limiter.currentCount(TierId.TIER_1, nextHour));
        assertTrue(limiter.checkOk(TierId.TIER_1, nextHour));
    }

    @Test
    void sameHourOnNextDayIsSeparateBucket() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(1));
        limiter.recordAndCheck(TierId.TIER_1, NOW);

        Instant tomorrow = NOW.plus(Duration.ofDays(1));

        assertEquals(0, limiter.currentCount(TierId.TIER_1, tomorrow));
        assertTrue(limiter.recordAndCheck(TierId.TIER_1, tomorrow));
    }

    @Test
    void oldBucketsArePrunedOnCommit() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(10));
        limiter.recordAndCheck(TierId.TIER_1, NOW.minus(Duration.ofHours(5)));
        limiter.recordAndCheck(TierId.TIER_1, NOW.minus(Duration.ofHours(1)));
        limiter.recordAndCheck(TierId.TIER_1, NOW);

        assertEquals(2, limiter.bucketCount());
    }

    @Test
    void tiersCountIndependently() {
        HourlyRateLimiter limiter = new HourlyRateLimiter(registry(
                tier(TierId.TIER_1, 0, 23, "UTC", 5, TierId.TIER_2),
                tier(TierId.TIER_2, 0, 23, "UTC", 5, null)
        ));
        limiter.recordAndCheck(TierId.TIER_1, NOW);

        assertEquals(1, limiter.currentCount(TierId.TIER_1, NOW));
        assertEquals(0, limiter.currentCount(TierId.TIER_2, NOW));
    }

    @Test
    void concurrentCommitsAreAllCounted() throws Exception {
        int calls = 200;
        HourlyRateLimiter limiter = new HourlyRateLimiter(capOf(1_000));
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<Boolean>> results = new ArrayList<>();
            for (int i = 0; i < calls; i++) {
                results.add(executor.submit(() -> {
                    start.await();
                    return limiter.recordAndCheck(TierId.TIER_1, NOW);
                }));
            }
            start.countDown();
            for (Future<Boolean> result : results) {
                assertTrue(result.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(calls, limiter.currentCount(TierId.TIER_1, NOW));
    }

    private static TierRegistry capOf(int cap) {
        return registry(tier(TierId.TIER_1, 0, 23, "UTC", cap, null));
    }
}
