package net.spookly.tierline.tier;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.experimental.Accessors;

/**
 * Half-open local-time window {@code [startHour, endHour)} in a tier-specific timezone.
 */
@Getter
@Accessors(fluent = true)
@AllArgsConstructor
public final class BusinessHours {
    private final int startHour;
    private final int endHour;
    /**
     * Zone id resolved lazily by the gate; an unknown id keeps the tier open.
     */
    private final String timezone;

    public boolean contains(int localHour) {
        return startHour <= localHour && localHour < endHour;
    }
}
