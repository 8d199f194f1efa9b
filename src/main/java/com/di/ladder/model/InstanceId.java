package com.di.ladder.model;

import lombok.Value;

/**
 * Identifies one instance of a tier. Rendered as {@code <tier>_<number>}, e.g. {@code gold_3}.
 */
@Value
public class InstanceId {

    Tier tier;
    int number;

    public InstanceId(Tier tier, int number) {
        if (tier == null) {
            throw new IllegalArgumentException("tier must not be null");
        }
        if (number < 1) {
            throw new IllegalArgumentException("instance number must be >= 1, was " + number);
        }
        this.tier = tier;
        this.number = number;
    }

    public static InstanceId of(Tier tier, int number) {
        return new InstanceId(tier, number);
    }

    @Override
    public String toString() {
        return tier.key() + "_" + number;
    }
}
