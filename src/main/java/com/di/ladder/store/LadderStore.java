package com.di.ladder.store;

import com.di.ladder.model.Tier;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Transactional access to the entities of one kind. The engine is the only writer of
 * tier/instance placement. Implementations can be in-memory or JDBC.
 * <p>
 * All finder and count methods skip placeholder entities unless stated otherwise.
 *
 * @param <E> entity type
 */
public interface LadderStore<E> {

    /**
     * Runs {@code work} in one transaction. Joins the caller's transaction when one is active.
     * When {@code work} throws, none of its writes are kept.
     */
    <T> T inTransaction(Supplier<T> work);

    /**
     * Runs {@code work} in one transaction while holding the mutual-exclusion lock of {@code tier}
     * for this kind. The lock is released when the outermost transaction commits or aborts.
     * Locks of different tiers never block each other.
     *
     * @throws com.di.ladder.exception.AssignmentContentionException when the lock cannot be taken
     */
    <T> T inTierTransaction(Tier tier, Supplier<T> work);

    /** Member count per instance number for the tier; instances without members are absent. */
    Map<Integer, Integer> countMembersByInstance(Tier tier);

    List<E> findByTier(Tier tier);

    List<E> findByInstance(Tier tier, int instanceNumber);

    /** Finds by id, placeholders included. */
    Optional<E> findById(long id);

    /** Persists a new entity as given (placement included) and returns it with its id. */
    E insert(E entity);

    /** Moves the entity to {@code tier}/{@code instanceNumber} and resets its cycles-in-tier to 0. */
    void updatePlacement(long id, Tier tier, int instanceNumber);

    /**
     * Changes only the instance number, and only while the entity is still in {@code expectedTier};
     * tier and cycles-in-tier are kept.
     *
     * @return false when the entity has left {@code expectedTier} and nothing was written
     */
    boolean updateInstance(long id, Tier expectedTier, int instanceNumber);

    /** Adds one to cycles-in-tier of every entity of this kind; returns the number updated. */
    int incrementCyclesInTier();

    long countAll();

    long countInTier(Tier tier);
}
