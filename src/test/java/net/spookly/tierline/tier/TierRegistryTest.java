package net.spookly.tierline.tier;

import static net.spookly.tierline.tier.TierFixtures.EASTERN;
import static net.spookly.tierline.tier.TierFixtures.registry;
import static net.spookly.tierline.tier.TierFixtures.tier;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import net.spookly.tierline.config.ConfigException;
import org.junit.jupiter.api.Test;

class TierRegistryTest {
    @Test
    void rejectsFallbackCycle() {
        ConfigException exception = assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 9, 21, EASTERN, 10, TierId.TIER_2),
                tier(TierId.TIER_2, 9, 21, EASTERN, 10, TierId.TIER_3),
                tier(TierId.TIER_3, 9, 21, EASTERN, 10, TierId.TIER_1)
        ));

        assertTrue(exception.getMessage().contains("acyclic"));
    }

    @Test
    void rejectsSelfFallback() {
        assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 9, 21, EASTERN, 10, TierId.TIER_1)
        ));
    }

    @Test
    void rejectsInvertedBusinessHours() {
        assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 21, 9, EASTERN, 10, null)
        ));
        assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 9, 9, EASTERN, 10, null)
        ));
    }

    @Test
    void rejectsFallbackToUnconfiguredTier() {
        assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 9, 21, EASTERN, 10, TierId.TIER_3)
        ));
    }

    @Test
    void rejectsNonPositiveCap() {
        assertThrows(ConfigException.class, () -> registry(
                tier(TierId.TIER_1, 9, 21, EASTERN, 0, null)
        ));
    }

    @Test
    void acceptsUnknownTimezoneAtLoad() {
        TierRegistry registry = registry(tier(TierId.TIER_1, 9, 21, "Mars/Olympus", 10, null));

        assertEquals("Mars/Olympus", registry.get(TierId.TIER_1).businessHours().timezone());
    }

    @Test
    void listsTiersInPriorityOrder() {
        TierRegistry registry = registry(
                tier(TierId.TIER_3, 0, 23, "UTC", 10, null),
                tier(TierId.TIER_1, 9, 21, EASTERN, 10, TierId.TIER_3)
        );

        assertEquals(List.of(TierId.TIER_1, TierId.TIER_3), List.copyOf(registry.tierIds()));
        assertFalse(registry.contains(TierId.TIER_2));
        assertThrows(IllegalArgumentException.class, () -> registry.get(TierId.TIER_2));
    }

    @Test
    void findCycleReportsTheLoop() {
        Map<TierId, TierId> fallbacks = new EnumMap<>(TierId.class);
        fallbacks.put(TierId.TIER_1, TierId.TIER_2);
        fallbacks.put(TierId.TIER_2, TierId.TIER_3);
        fallbacks.put(TierId.TIER_3, TierId.TIER_2);

        Optional<List<TierId>> cycle = TierRegistry.findCycle(fallbacks);

        assertTrue(cycle.isPresent());
        assertEquals(List.of(TierId.TIER_2, TierId.TIER_3, TierId.TIER_2), cycle.get());
    }

    @Test
    void findCycleAcceptsFiniteChains() {
        Map<TierId, TierId> fallbacks = new EnumMap<>(TierId.class);
        fallbacks.put(TierId.TIER_1, TierId.TIER_2);
        fallbacks.put(TierId.TIER_2, TierId.TIER_3);

        assertTrue(TierRegistry.findCycle(fallbacks).isEmpty());
    }
}
