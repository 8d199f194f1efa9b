package com.di.ladder.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Report of one full rebalancing run. Never persisted; a partial summary (with errors) is still valid.
 */
@Value
@Builder
public class RebalancingSummary {
    long cycleNumber;
    String entityKind;
    long totalEntities;
    @Singular
    List<TierSummary> tierSummaries;
    @Singular
    List<RedistributionResult> redistributions;
    @Singular
    List<RebalanceError> errors;
    Instant startedAt;
    Instant finishedAt;

    public int getTotalPromoted() {
        return tierSummaries.stream().mapToInt(TierSummary::getPromoted).sum();
    }

    public int getTotalDemoted() {
        return tierSummaries.stream().mapToInt(TierSummary::getDemoted).sum();
    }

    @JsonIgnore
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
