package com.di.ladder.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

/**
 * Occupancy of one instance at the time it was read.
 */
@Value
public class InstanceOccupancy {
    Tier tier;
    int instanceNumber;
    int memberCount;
    int capacity;

    @JsonProperty("instanceId")
    public InstanceId getInstanceId() {
        return InstanceId.of(tier, instanceNumber);
    }

    @JsonProperty("full")
    public boolean isFull() {
        return memberCount >= capacity;
    }

    public boolean isOverCapacity() {
        return memberCount > capacity;
    }
}
