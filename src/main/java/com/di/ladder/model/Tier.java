package com.di.ladder.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Ordered competitive tiers, lowest first. Declaration order is the ladder order.
 */
public enum Tier {
    BRONZE,
    SILVER,
    GOLD,
    PLATINUM,
    DIAMOND,
    CHAMPION;

    /** Tier above this one; empty for the top tier. */
    public Optional<Tier> successor() {
        Tier[] all = values();
        return ordinal() == all.length - 1 ? Optional.empty() : Optional.of(all[ordinal() + 1]);
    }

    /** Tier below this one; empty for the bottom tier. */
    public Optional<Tier> predecessor() {
        return ordinal() == 0 ? Optional.empty() : Optional.of(values()[ordinal() - 1]);
    }

    public boolean isTop() {
        return successor().isEmpty();
    }

    public boolean isBottom() {
        return predecessor().isEmpty();
    }

    /** Lower-case key used in instance ids and storage, e.g. {@code bronze}. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a tier key (case-insensitive).
     *
     * @throws IllegalArgumentException for blank or unknown keys
     */
    public static Tier fromKey(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Tier key must not be blank");
        }
        try {
            return valueOf(key.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown tier: " + key, e);
        }
    }
}
