package com.di.ladder.kind;

import com.di.ladder.model.Tier;

import java.util.Comparator;

/**
 * Describes one kind of ladder participant to the generic engine: how to read and rewrite its
 * placement fields, its ranking inputs, and the capacity of its instances.
 * <p>
 * Entities are immutable; the {@code with*} methods return updated copies.
 *
 * @param <E> entity type
 */
public interface EntityKind<E> {

    /** Short kind name used in logs, metrics tags and lock keys, e.g. {@code combatant}. */
    String name();

    /** Maximum members per instance. */
    int capacity();

    long idOf(E entity);

    Tier tierOf(E entity);

    int instanceOf(E entity);

    int pointsOf(E entity);

    int ratingOf(E entity);

    int cyclesInTierOf(E entity);

    boolean isPlaceholder(E entity);

    E withId(E entity, long id);

    /** Copy placed in {@code tier}/{@code instanceNumber}; other fields untouched. */
    E withPlacement(E entity, Tier tier, int instanceNumber);

    E withCyclesInTier(E entity, int cyclesInTier);

    /** Order used when a tier is redistributed across instances. */
    Comparator<E> redistributionOrder();

    /** Best first: points desc, rating desc, then id asc so the order is total. */
    default Comparator<E> rankingOrder() {
        return Comparator.comparingInt((E e) -> pointsOf(e)).reversed()
                .thenComparing(Comparator.comparingInt((E e) -> ratingOf(e)).reversed())
                .thenComparingLong(this::idOf);
    }

    /** Worst first: points asc, rating asc, then id asc. */
    default Comparator<E> reverseRankingOrder() {
        return Comparator.comparingInt((E e) -> pointsOf(e))
                .thenComparingInt(this::ratingOf)
                .thenComparingLong(this::idOf);
    }
}
