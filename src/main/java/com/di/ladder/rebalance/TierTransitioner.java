package com.di.ladder.rebalance;

import com.di.ladder.exception.BoundaryTierViolationException;
import com.di.ladder.exception.EntityNotFoundException;
import com.di.ladder.instance.InstanceAssigner;
import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.Placement;
import com.di.ladder.model.RebalanceOperation;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;
import com.di.ladder.util.LadderMetrics;
import lombok.extern.slf4j.Slf4j;

/**
 * Moves one entity to another tier. The destination instance is chosen with the same rules and
 * under the same tier lock as a fresh admission; points are kept and cycles-in-tier restarts at 0.
 */
@Slf4j
public class TierTransitioner<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final InstanceAssigner<E> assigner;
    private final LadderMetrics metrics;

    public TierTransitioner(EntityKind<E> kind, LadderStore<E> store, InstanceAssigner<E> assigner,
                            LadderMetrics metrics) {
        this.kind = kind;
        this.store = store;
        this.assigner = assigner;
        this.metrics = metrics;
    }

    /**
     * @throws BoundaryTierViolationException when the entity is already in the top tier
     */
    public Placement promote(long entityId) {
        return store.inTransaction(() -> {
            E entity = require(entityId);
            Tier from = kind.tierOf(entity);
            Tier to = from.successor()
                    .orElseThrow(() -> new BoundaryTierViolationException(entityId, from, RebalanceOperation.PROMOTION));
            Placement placement = move(entity, to);
            metrics.recordPromotion();
            return placement;
        });
    }

    /**
     * @throws BoundaryTierViolationException when the entity is already in the bottom tier
     */
    public Placement demote(long entityId) {
        return store.inTransaction(() -> {
            E entity = require(entityId);
            Tier from = kind.tierOf(entity);
            Tier to = from.predecessor()
                    .orElseThrow(() -> new BoundaryTierViolationException(entityId, from, RebalanceOperation.DEMOTION));
            Placement placement = move(entity, to);
            metrics.recordDemotion();
            return placement;
        });
    }

    /**
     * Relocates the entity to any tier, outside the promotion/demotion flow. Moving to the
     * entity's current tier changes nothing.
     */
    public Placement moveToTier(long entityId, Tier target) {
        return store.inTransaction(() -> {
            E entity = require(entityId);
            if (kind.tierOf(entity) == target) {
                log.debug("[TRANSITION] {} {} already in {}, nothing to do", kind.name(), entityId, target.key());
                return Placement.builder()
                        .entityId(entityId)
                        .fromTier(target)
                        .fromInstance(kind.instanceOf(entity))
                        .toTier(target)
                        .toInstance(kind.instanceOf(entity))
                        .points(kind.pointsOf(entity))
                        .build();
            }
            return move(entity, target);
        });
    }

    private Placement move(E entity, Tier to) {
        long id = kind.idOf(entity);
        Tier from = kind.tierOf(entity);
        int fromInstance = kind.instanceOf(entity);
        return store.inTierTransaction(to, () -> {
            int instance = assigner.chooseInstance(to);
            store.updatePlacement(id, to, instance);
            log.info("[TRANSITION] {} {} moved {}_{} -> {}_{} (points={})",
                    kind.name(), id, from.key(), fromInstance, to.key(), instance, kind.pointsOf(entity));
            return Placement.builder()
                    .entityId(id)
                    .fromTier(from)
                    .fromInstance(fromInstance)
                    .toTier(to)
                    .toInstance(instance)
                    .points(kind.pointsOf(entity))
                    .build();
        });
    }

    private E require(long entityId) {
        return store.findById(entityId).orElseThrow(() -> new EntityNotFoundException(kind.name(), entityId));
    }
}
