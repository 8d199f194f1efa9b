package com.di.ladder.instance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.RedistributionResult;
import com.di.ladder.model.Tier;
import com.di.ladder.model.TierStats;
import com.di.ladder.store.LadderStore;
import com.di.ladder.util.LadderMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

/**
 * Recomputes instance membership of a whole tier: entities in deterministic rank order are dealt
 * into {@code targetInstanceCount} consecutive instances of equal size, numbered from 1.
 * <p>
 * Holds the tier lock for the full read-and-rewrite, so admissions into the tier wait for it.
 */
@Slf4j
public class Redistributor<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final RebalanceDetector<E> detector;
    private final LadderMetrics metrics;

    public Redistributor(EntityKind<E> kind, LadderStore<E> store, RebalanceDetector<E> detector,
                         LadderMetrics metrics) {
        this.kind = kind;
        this.store = store;
        this.detector = detector;
        this.metrics = metrics;
    }

    /**
     * Redistributes {@code tier} when the detector flags it; otherwise returns a skipped result.
     */
    public RedistributionResult redistribute(Tier tier) {
        return store.inTierTransaction(tier, () -> {
            TierStats stats = detector.stats(tier);
            int instancesBefore = stats.getInstances().size();
            if (!stats.isNeedsRebalancing()) {
                log.info("[REDISTRIBUTOR] {} {} instances balanced, no action needed", kind.name(), tier.key());
                return RedistributionResult.skipped(tier, stats.getTotalMembers(), instancesBefore);
            }

            List<E> members = new ArrayList<>(store.findByTier(tier));
            members.sort(kind.redistributionOrder());
            int total = members.size();

            // never consolidate below the current instance count
            int targetInstanceCount = Math.max(ceilDiv(total, kind.capacity()), instancesBefore);
            targetInstanceCount = Math.max(targetInstanceCount, 1);
            int perInstance = Math.max(ceilDiv(total, targetInstanceCount), 1);

            log.info("[REDISTRIBUTOR] Rebalancing {} {}: total={}, instances={}, avg={}, target={}, perInstance={}",
                    kind.name(), tier.key(), total, instancesBefore,
                    String.format("%.1f", stats.getAveragePerInstance()), targetInstanceCount, perInstance);

            int relocated = 0;
            for (int rank = 0; rank < total; rank++) {
                E entity = members.get(rank);
                int target = rank / perInstance + 1;
                if (kind.instanceOf(entity) == target) {
                    continue;
                }
                if (store.updateInstance(kind.idOf(entity), tier, target)) {
                    relocated++;
                } else {
                    log.warn("[REDISTRIBUTOR] {} {} left {} during redistribution, skipped",
                            kind.name(), kind.idOf(entity), tier.key());
                }
            }

            metrics.recordRedistribution(relocated);
            log.info("[REDISTRIBUTOR] Moved {} {}(s) across {} {} instances",
                    relocated, kind.name(), targetInstanceCount, tier.key());
            return RedistributionResult.builder()
                    .tier(tier)
                    .performed(true)
                    .totalMembers(total)
                    .instancesBefore(instancesBefore)
                    .targetInstanceCount(targetInstanceCount)
                    .perInstance(perInstance)
                    .relocated(relocated)
                    .build();
        });
    }

    private static int ceilDiv(int a, int b) {
        return (a + b - 1) / b;
    }
}
