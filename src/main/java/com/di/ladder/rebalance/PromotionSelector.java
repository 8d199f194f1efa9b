package com.di.ladder.rebalance;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;

import java.util.Comparator;

/**
 * Top fraction of an instance by points, rating, then id. Only entities at or above the
 * absolute points gate qualify, so a weak instance can promote fewer than its quota.
 */
public class PromotionSelector<E> extends PercentileSelector<E> {

    private final int minPointsForPromotion;

    public PromotionSelector(EntityKind<E> kind, LadderStore<E> store, double fraction,
                             int minCyclesInTier, int minEligiblePerInstance, int minPointsForPromotion) {
        super(kind, store, fraction, minCyclesInTier, minEligiblePerInstance);
        this.minPointsForPromotion = minPointsForPromotion;
    }

    @Override
    protected boolean isBoundary(Tier tier) {
        return tier.isTop();
    }

    @Override
    protected Comparator<E> order() {
        return kind.rankingOrder();
    }

    @Override
    protected boolean gate(E entity) {
        return kind.pointsOf(entity) >= minPointsForPromotion;
    }
}
