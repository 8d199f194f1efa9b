package com.di.ladder.rebalance;

import com.di.ladder.exception.ErrorCategory;
import com.di.ladder.instance.InstanceDirectory;
import com.di.ladder.instance.RebalanceDetector;
import com.di.ladder.instance.Redistributor;
import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.RebalanceError;
import com.di.ladder.model.RebalanceOperation;
import com.di.ladder.model.RebalancingSummary;
import com.di.ladder.model.RedistributionResult;
import com.di.ladder.model.Tier;
import com.di.ladder.model.TierStats;
import com.di.ladder.model.TierSummary;
import com.di.ladder.store.LadderStore;
import com.di.ladder.util.LadderMetrics;
import com.di.ladder.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One full rebalancing run over every tier of a kind.
 * <p>
 * Tiers are walked bottom-up with a single exclusion set shared by the whole run, so an entity
 * moves at most once per run. A failed move is recorded in the summary and the run goes on.
 * When all moves are done, tiers with an instance over capacity are redistributed; tiers that are
 * only uneven are reported and left alone.
 */
@Slf4j
public class RebalanceOrchestrator<E> {

    public static final String MDC_CYCLE_NUMBER = "cycleNumber";
    public static final String MDC_ENTITY_KIND = "entityKind";

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final InstanceDirectory<E> directory;
    private final PromotionSelector<E> promotionSelector;
    private final DemotionSelector<E> demotionSelector;
    private final TierTransitioner<E> transitioner;
    private final RebalanceDetector<E> detector;
    private final Redistributor<E> redistributor;
    private final LadderMetrics metrics;

    public RebalanceOrchestrator(EntityKind<E> kind,
                                 LadderStore<E> store,
                                 InstanceDirectory<E> directory,
                                 PromotionSelector<E> promotionSelector,
                                 DemotionSelector<E> demotionSelector,
                                 TierTransitioner<E> transitioner,
                                 RebalanceDetector<E> detector,
                                 Redistributor<E> redistributor,
                                 LadderMetrics metrics) {
        this.kind = kind;
        this.store = store;
        this.directory = directory;
        this.promotionSelector = promotionSelector;
        this.demotionSelector = demotionSelector;
        this.transitioner = transitioner;
        this.detector = detector;
        this.redistributor = redistributor;
        this.metrics = metrics;
    }

    public RebalancingSummary runFullCycle(long cycleNumber) {
        Map<String, String> context = Map.of(
                MDC_CYCLE_NUMBER, String.valueOf(cycleNumber),
                MDC_ENTITY_KIND, kind.name());
        return MdcPropagation.callWithContext(context, () -> run(cycleNumber));
    }

    private RebalancingSummary run(long cycleNumber) {
        Instant startedAt = Instant.now();
        log.info("[REBALANCE] Starting {} rebalance for cycle {}", kind.name(), cycleNumber);

        RebalancingSummary.RebalancingSummaryBuilder summary = RebalancingSummary.builder()
                .cycleNumber(cycleNumber)
                .entityKind(kind.name())
                .startedAt(startedAt);
        Set<Long> moved = new HashSet<>();

        for (Tier tier : Tier.values()) {
            summary.tierSummary(processTier(tier, moved, summary));
        }

        for (Tier tier : Tier.values()) {
            redistributeIfOverCapacity(tier, summary);
        }

        Instant finishedAt = Instant.now();
        RebalancingSummary result = summary
                .totalEntities(store.countAll())
                .finishedAt(finishedAt)
                .build();
        metrics.recordRun(Duration.between(startedAt, finishedAt).toMillis());

        if (result.hasErrors()) {
            log.warn("[REBALANCE] Cycle {} {} finished with {} error(s): promoted={}, demoted={}, redistributed={}",
                    cycleNumber, kind.name(), result.getErrors().size(), result.getTotalPromoted(),
                    result.getTotalDemoted(), result.getRedistributions().size());
        } else {
            log.info("[REBALANCE] Cycle {} {} finished: promoted={}, demoted={}, redistributed={}",
                    cycleNumber, kind.name(), result.getTotalPromoted(), result.getTotalDemoted(),
                    result.getRedistributions().size());
        }
        return result;
    }

    private TierSummary processTier(Tier tier, Set<Long> moved, RebalancingSummary.RebalancingSummaryBuilder summary) {
        List<InstanceOccupancy> instances;
        try {
            instances = directory.listInstances(tier);
        } catch (RuntimeException e) {
            recordError(summary, tier, null, RebalanceOperation.TIER_SCAN, e);
            return TierSummary.builder().tier(tier).build();
        }

        int entitiesInTier = instances.stream().mapToInt(InstanceOccupancy::getMemberCount).sum();
        int eligible = 0;
        int promoted = 0;
        int demoted = 0;

        for (InstanceOccupancy instance : instances) {
            List<E> members;
            try {
                members = store.findByInstance(tier, instance.getInstanceNumber());
            } catch (RuntimeException e) {
                recordError(summary, tier, null, RebalanceOperation.TIER_SCAN, e);
                continue;
            }
            eligible += promotionSelector.eligible(members, moved).size();

            // both selections see the same population; moves happen afterwards
            List<E> promotions = promotionSelector.select(tier, members, moved);
            List<E> demotions = demotionSelector.select(tier, members, moved);
            Set<Long> promotionIds = new HashSet<>();
            promotions.forEach(e -> promotionIds.add(kind.idOf(e)));

            for (E candidate : promotions) {
                long id = kind.idOf(candidate);
                try {
                    transitioner.promote(id);
                    moved.add(id);
                    promoted++;
                } catch (RuntimeException e) {
                    recordError(summary, tier, id, RebalanceOperation.PROMOTION, e);
                }
            }

            for (E candidate : demotions) {
                long id = kind.idOf(candidate);
                if (moved.contains(id) || promotionIds.contains(id)) {
                    continue;
                }
                try {
                    transitioner.demote(id);
                    moved.add(id);
                    demoted++;
                } catch (RuntimeException e) {
                    recordError(summary, tier, id, RebalanceOperation.DEMOTION, e);
                }
            }
        }

        if (promoted > 0 || demoted > 0) {
            log.info("[REBALANCE] {} {}: instances={}, entities={}, eligible={}, promoted={}, demoted={}",
                    kind.name(), tier.key(), instances.size(), entitiesInTier, eligible, promoted, demoted);
        }
        return TierSummary.builder()
                .tier(tier)
                .entitiesInTier(entitiesInTier)
                .instances(instances.size())
                .eligible(eligible)
                .promoted(promoted)
                .demoted(demoted)
                .build();
    }

    private void redistributeIfOverCapacity(Tier tier, RebalancingSummary.RebalancingSummaryBuilder summary) {
        try {
            TierStats stats = detector.stats(tier);
            if (stats.isOverCapacity()) {
                RedistributionResult result = redistributor.redistribute(tier);
                if (result.isPerformed()) {
                    summary.redistribution(result);
                }
            } else if (stats.isDeviationExceeded()) {
                log.warn("[REBALANCE] {} {} instances uneven (avg={}, threshold exceeded) but within capacity; "
                                + "leaving as is", kind.name(), tier.key(),
                        String.format("%.1f", stats.getAveragePerInstance()));
            }
        } catch (RuntimeException e) {
            recordError(summary, tier, null, RebalanceOperation.REDISTRIBUTION, e);
        }
    }

    private void recordError(RebalancingSummary.RebalancingSummaryBuilder summary, Tier tier, Long entityId,
                             RebalanceOperation operation, RuntimeException e) {
        ErrorCategory category = ErrorCategory.categorize(e);
        log.error("[REBALANCE] {} failed for {} {} in {} [{}]: {}", operation, kind.name(),
                entityId != null ? entityId : "-", tier.key(), category.getName(), e.getMessage(), e);
        metrics.recordFailure(operation);
        summary.error(RebalanceError.builder()
                .tier(tier)
                .entityId(entityId)
                .operation(operation)
                .category(category)
                .message(e.getMessage())
                .build());
    }
}
