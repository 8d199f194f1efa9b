package com.di.ladder.exception;

import com.di.ladder.model.RebalanceOperation;
import com.di.ladder.model.Tier;
import lombok.Getter;

/**
 * Promotion out of the top tier or demotion out of the bottom tier was requested.
 * Selectors never produce such moves, so this always indicates a caller bug.
 */
@Getter
public class BoundaryTierViolationException extends LadderException {

    private final long entityId;
    private final Tier tier;
    private final RebalanceOperation operation;

    public BoundaryTierViolationException(long entityId, Tier tier, RebalanceOperation operation) {
        super("Cannot " + (operation == RebalanceOperation.PROMOTION ? "promote" : "demote")
                + " entity " + entityId + " from " + tier.key() + " - already at "
                + (operation == RebalanceOperation.PROMOTION ? "top" : "bottom") + " tier");
        this.entityId = entityId;
        this.tier = tier;
        this.operation = operation;
    }
}
