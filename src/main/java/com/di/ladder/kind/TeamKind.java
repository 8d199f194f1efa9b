package com.di.ladder.kind;

import com.di.ladder.model.TagTeam;
import com.di.ladder.model.Tier;

import java.util.Comparator;

/**
 * Paired teams. Rating is the combined rating of both members.
 */
public class TeamKind implements EntityKind<TagTeam> {

    public static final String NAME = "team";

    private final int capacity;

    public TeamKind(int capacity) {
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
    public long idOf(TagTeam t) {
        return t.getId();
    }

    @Override
    public Tier tierOf(TagTeam t) {
        return t.getTier();
    }

    @Override
    public int instanceOf(TagTeam t) {
        return t.getInstanceNumber();
    }

    @Override
    public int pointsOf(TagTeam t) {
        return t.getPoints();
    }

    @Override
    public int ratingOf(TagTeam t) {
        return t.getCombinedRating();
    }

    @Override
    public int cyclesInTierOf(TagTeam t) {
        return t.getCyclesInTier();
    }

    @Override
    public boolean isPlaceholder(TagTeam t) {
        return t.isPlaceholder();
    }

    @Override
    public TagTeam withId(TagTeam t, long id) {
        return t.toBuilder().id(id).build();
    }

    @Override
    public TagTeam withPlacement(TagTeam t, Tier tier, int instanceNumber) {
        return t.toBuilder().tier(tier).instanceNumber(instanceNumber).build();
    }

    @Override
    public TagTeam withCyclesInTier(TagTeam t, int cyclesInTier) {
        return t.toBuilder().cyclesInTier(cyclesInTier).build();
    }

    /** Points desc, then id asc: team redistribution ignores rating. */
    @Override
    public Comparator<TagTeam> redistributionOrder() {
        return Comparator.comparingInt(TagTeam::getPoints).reversed()
                .thenComparingLong(TagTeam::getId);
    }
}
