package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

/**
 * Result of one redistribution pass over a tier.
 */
@Value
@Builder
public class RedistributionResult {
    Tier tier;
    /** False when the tier turned out to be balanced and nothing was rewritten. */
    boolean performed;
    int totalMembers;
    int instancesBefore;
    int targetInstanceCount;
    int perInstance;
    /** Number of entities whose instance changed. */
    int relocated;

    public static RedistributionResult skipped(Tier tier, int totalMembers, int instances) {
        return RedistributionResult.builder()
                .tier(tier)
                .performed(false)
                .totalMembers(totalMembers)
                .instancesBefore(instances)
                .targetInstanceCount(instances)
                .build();
    }
}
