package com.di.ladder.model;

import lombok.Value;

import java.util.List;

/**
 * Occupancy statistics for one tier, plus the imbalance verdicts derived from them.
 */
@Value
public class TierStats {
    Tier tier;
    List<InstanceOccupancy> instances;
    int totalMembers;
    double averagePerInstance;
    /** At least one instance deviates from the average by more than the threshold. */
    boolean deviationExceeded;
    /** At least one instance holds more members than its capacity. */
    boolean overCapacity;

    public boolean isNeedsRebalancing() {
        return deviationExceeded || overCapacity;
    }
}
