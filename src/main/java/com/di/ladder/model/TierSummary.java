package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

/**
 * Per-tier counts of one rebalancing run.
 */
@Value
@Builder
public class TierSummary {
    Tier tier;
    int entitiesInTier;
    int instances;
    int eligible;
    int promoted;
    int demoted;
}
