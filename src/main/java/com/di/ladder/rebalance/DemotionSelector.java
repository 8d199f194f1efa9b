package com.di.ladder.rebalance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;

import java.util.Comparator;

/**
 * Bottom fraction of an instance: lowest points, then lowest rating, then id.
 */
public class DemotionSelector<E> extends PercentileSelector<E> {

    public DemotionSelector(EntityKind<E> kind, LadderStore<E> store, double fraction,
                            int minCyclesInTier, int minEligiblePerInstance) {
        super(kind, store, fraction, minCyclesInTier, minEligiblePerInstance);
    }

    @Override
    protected boolean isBoundary(Tier tier) {
        return tier.isBottom();
    }

    @Override
    protected Comparator<E> order() {
        return kind.reverseRankingOrder();
    }
}
