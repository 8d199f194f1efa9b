package com.di.ladder.kind;

import com.di.ladder.model.Combatant;
import com.di.ladder.model.Tier;

import java.util.Comparator;

public class CombatantKind implements EntityKind<Combatant> {

    public static final String NAME = "combatant";

    private final int capacity;

    public CombatantKind(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public int capacity() {
        return capacity;
    }

    @Override
    public long idOf(Combatant c) {
        return c.getId();
    }

    @Override
    public Tier tierOf(Combatant c) {
        return c.getTier();
    }

    @Override
    public int instanceOf(Combatant c) {
        return c.getInstanceNumber();
    }

    @Override
    public int pointsOf(Combatant c) {
        return c.getPoints();
    }

    @Override
    public int ratingOf(Combatant c) {
        return c.getRating();
    }

    @Override
    public int cyclesInTierOf(Combatant c) {
        return c.getCyclesInTier();
    }

    @Override
    public boolean isPlaceholder(Combatant c) {
        return c.isPlaceholder();
    }

    @Override
    public Combatant withId(Combatant c, long id) {
        return c.toBuilder().id(id).build();
    }

    @Override
    public Combatant withPlacement(Combatant c, Tier tier, int instanceNumber) {
        return c.toBuilder().tier(tier).instanceNumber(instanceNumber).build();
    }

    @Override
    public Combatant withCyclesInTier(Combatant c, int cyclesInTier) {
        return c.toBuilder().cyclesInTier(cyclesInTier).build();
    }

    /** Same as the ranking order: points desc, rating desc. */
    @Override
    public Comparator<Combatant> redistributionOrder() {
        return rankingOrder();
    }
}
