package com.di.ladder.rebalance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;

import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Shared selection rules for promotion and demotion within one instance.
 * <p>
 * An entity is eligible when it is not excluded for this run and has spent at least
 * {@code minCyclesInTier} cycles in its tier. An instance with fewer than
 * {@code minEligiblePerInstance} eligible entities yields nothing. Otherwise
 * {@code floor(eligible * fraction)} entities are taken in {@link #order()} after
 * {@link #gate(Object)} has been applied.
 */
public abstract class PercentileSelector<E> {

    protected final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final double fraction;
    private final int minCyclesInTier;
    private final int minEligiblePerInstance;

    protected PercentileSelector(EntityKind<E> kind, LadderStore<E> store, double fraction,
                                 int minCyclesInTier, int minEligiblePerInstance) {
        if (fraction < 0.0 || fraction > 1.0) {
            throw new IllegalArgumentException("fraction must be within [0, 1], was " + fraction);
        }
        this.kind = kind;
        this.store = store;
        this.fraction = fraction;
        this.minCyclesInTier = minCyclesInTier;
        this.minEligiblePerInstance = minEligiblePerInstance;
    }

    /** True when entities of {@code tier} can never move in this direction. */
    protected abstract boolean isBoundary(Tier tier);

    /** Best candidates first. */
    protected abstract Comparator<E> order();

    /** Extra per-entity condition applied after the percentile count is fixed. */
    protected boolean gate(E entity) {
        return true;
    }

    /** Reads the instance and selects from it. */
    public List<E> select(Tier tier, int instanceNumber, Set<Long> excluded) {
        if (isBoundary(tier)) {
            return List.of();
        }
        return select(tier, store.findByInstance(tier, instanceNumber), excluded);
    }

    /** Selects from {@code members}, which must all belong to one instance of {@code tier}. */
    public List<E> select(Tier tier, List<E> members, Set<Long> excluded) {
        if (isBoundary(tier)) {
            return List.of();
        }
        List<E> eligible = eligible(members, excluded);
        if (eligible.size() < minEligiblePerInstance) {
            return List.of();
        }
        int count = selectionCount(eligible.size());
        if (count == 0) {
            return List.of();
        }
        return eligible.stream()
                .filter(this::gate)
                .sorted(order())
                .limit(count)
                .collect(Collectors.toList());
    }

    public List<E> eligible(List<E> members, Set<Long> excluded) {
        return members.stream()
                .filter(e -> !kind.isPlaceholder(e))
                .filter(e -> !excluded.contains(kind.idOf(e)))
                .filter(e -> kind.cyclesInTierOf(e) >= minCyclesInTier)
                .collect(Collectors.toList());
    }

    int selectionCount(int eligibleCount) {
        // epsilon keeps 30 * 0.1 at 3 instead of 2
        return (int) Math.floor(eligibleCount * fraction + 1e-9);
    }
}
