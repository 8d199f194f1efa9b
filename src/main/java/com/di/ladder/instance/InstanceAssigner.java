package com.di.ladder.instance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;
import com.di.ladder.util.LadderMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the instance a new member of a tier joins. Every decision is made while holding the
 * tier's lock, so concurrent admissions to one tier can neither overfill an instance nor open
 * two instances with the same number.
 */
@Slf4j
public class InstanceAssigner<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final InstanceDirectory<E> directory;
    private final LadderMetrics metrics;

    public InstanceAssigner(EntityKind<E> kind, LadderStore<E> store, InstanceDirectory<E> directory,
                            LadderMetrics metrics) {
        this.kind = kind;
        this.store = store;
        this.directory = directory;
        this.metrics = metrics;
    }

    /**
     * Returns an instance number of {@code tier} with room for one more member at the time of the
     * call. Runs in its own tier-locked transaction.
     */
    public int assign(Tier tier) {
        return store.inTierTransaction(tier, () -> {
            List<InstanceOccupancy> instances = directory.listInstances(tier);
            int instance = choose(tier, instances);
            recordAdmission(instances, instance);
            return instance;
        });
    }

    /**
     * Creates {@code draft} in {@code tier} inside the same locked transaction that picks its
     * instance, so the chosen slot cannot be taken before the row exists.
     */
    public E admit(E draft, Tier tier) {
        return store.inTierTransaction(tier, () -> {
            List<InstanceOccupancy> instances = directory.listInstances(tier);
            int instance = choose(tier, instances);
            E stored = store.insert(kind.withPlacement(draft, tier, instance));
            recordAdmission(instances, instance);
            log.debug("[ASSIGNER] Admitted {} {} to {}_{}", kind.name(), kind.idOf(stored), tier.key(), instance);
            return stored;
        });
    }

    /**
     * Decision step of {@link #assign(Tier)}, without recording an admission. The caller must
     * already hold the lock of {@code tier} and must write its assignment before that lock is released.
     */
    public int chooseInstance(Tier tier) {
        return choose(tier, directory.listInstances(tier));
    }

    private int choose(Tier tier, List<InstanceOccupancy> instances) {
        if (instances.isEmpty()) {
            log.info("[ASSIGNER] {} tier {} has no instances, opening {}_1", kind.name(), tier.key(), tier.key());
            return 1;
        }

        InstanceOccupancy leastFull = instances.stream()
                .min(Comparator.comparingInt(InstanceOccupancy::getMemberCount)
                        .thenComparingInt(InstanceOccupancy::getInstanceNumber))
                .orElseThrow();

        if (leastFull.getMemberCount() >= kind.capacity()) {
            int next = instances.stream().mapToInt(InstanceOccupancy::getInstanceNumber).max().orElse(0) + 1;
            log.info("[ASSIGNER] All {} {} instances at capacity {}, opening {}_{}",
                    instances.size(), tier.key(), kind.capacity(), tier.key(), next);
            return next;
        }

        return leastFull.getInstanceNumber();
    }

    private void recordAdmission(List<InstanceOccupancy> instances, int chosen) {
        metrics.recordAdmission(instances.stream().noneMatch(i -> i.getInstanceNumber() == chosen));
    }
}
