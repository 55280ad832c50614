package net.spookly.tierline.tier;

import java.util.Locale;
import java.util.Optional;

/**
 * Fixed set of priced routing tiers. Declaration order is the tier priority order.
 */
public enum TierId {
    TIER_1("tier_1"),
    TIER_2("tier_2"),
    TIER_3("tier_3");

    private final String label;

    TierId(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Parse a tier label such as {@code tier_1}, {@code Tier 1}, {@code TIER-1} or {@code 1}.
     */
    public static Optional<TierId> fromLabel(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replaceAll("[\\s\\-]+", "_");
        if (normalized.isEmpty()) {
            return Optional.empty();
        }
        if (normalized.chars().allMatch(Character::isDigit)) {
            normalized = "tier_" + normalized;
        } else if (normalized.startsWith("tier") && !normalized.startsWith("tier_")) {
            normalized = "tier_" + normalized.substring("tier".length());
        }
        for (TierId tier : values()) {
            if (tier.label.equals(normalized)) {
                return Optional.of(tier);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return label;
    }
}
