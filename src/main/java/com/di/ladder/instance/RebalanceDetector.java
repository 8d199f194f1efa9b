package com.di.ladder.instance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.Tier;
import com.di.ladder.model.TierStats;

import java.util.List;

/**
 * Decides whether a tier's instances are out of balance.
 * <p>
 * Two independent conditions: an instance deviates from the tier average by more than the
 * threshold, or an instance holds more than its capacity. The second one is checked on its own
 * because a single oversized instance is always exactly at the average.
 */
public class RebalanceDetector<E> {

    private final EntityKind<E> kind;
    private final InstanceDirectory<E> directory;
    private final int deviationThreshold;

    public RebalanceDetector(EntityKind<E> kind, InstanceDirectory<E> directory, int deviationThreshold) {
        this.kind = kind;
        this.directory = directory;
        this.deviationThreshold = deviationThreshold;
    }

    public TierStats stats(Tier tier) {
        return evaluate(tier, directory.listInstances(tier));
    }

    public boolean needsRebalancing(Tier tier) {
        return stats(tier).isNeedsRebalancing();
    }

    /** Stats for an occupancy snapshot the caller already holds. */
    public TierStats evaluate(Tier tier, List<InstanceOccupancy> instances) {
        int total = instances.stream().mapToInt(InstanceOccupancy::getMemberCount).sum();
        double average = instances.isEmpty() ? 0.0 : (double) total / instances.size();
        boolean deviation = instances.stream()
                .anyMatch(i -> Math.abs(i.getMemberCount() - average) > deviationThreshold);
        boolean overCapacity = instances.stream()
                .anyMatch(i -> i.getMemberCount() > kind.capacity());
        return new TierStats(tier, List.copyOf(instances), total, average, deviation, overCapacity);
    }
}
