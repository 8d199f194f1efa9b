package com.di.ladder.model;

/**
 * Step of a rebalancing run an error is attributed to.
 */
public enum RebalanceOperation {
    PROMOTION,
    DEMOTION,
    TIER_SCAN,
    REDISTRIBUTION
}
