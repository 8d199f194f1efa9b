package com.di.ladder.model;

import com.di.ladder.exception.ErrorCategory;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

/**
 * A failure absorbed by a rebalancing run. The run continues past it.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RebalanceError {
    Tier tier;
    /** Null when the failure is not tied to one entity (tier scan, redistribution). */
    Long entityId;
    RebalanceOperation operation;
    ErrorCategory category;
    String message;

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(tier != null ? tier.key() : "?").append(": ").append(operation);
        if (entityId != null) {
            sb.append(" entity=").append(entityId);
        }
        sb.append(" [").append(category).append("] ").append(message);
        return sb.toString();
    }
}
