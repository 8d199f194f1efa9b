package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of moving one entity between tiers.
 */
@Value
@Builder
public class Placement {
    long entityId;
    Tier fromTier;
    int fromInstance;
    Tier toTier;
    int toInstance;
    int points;

    public InstanceId getDestination() {
        return InstanceId.of(toTier, toInstance);
    }
}
