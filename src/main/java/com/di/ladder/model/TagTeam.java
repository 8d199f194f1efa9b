package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

/**
 * A paired team (active + reserve member) on the team ladder.
 */
@Value
@Builder(toBuilder = true)
public class TagTeam {
    long id;
    long stableId;
    long activeMemberId;
    long reserveMemberId;
    Tier tier;
    int instanceNumber;
    int points;
    int activeRating;
    int reserveRating;
    int cyclesInTier;
    boolean placeholder;

    /** Team rating used for tie-breaks: sum of both members' ratings. */
    public int getCombinedRating() {
        return activeRating + reserveRating;
    }
}
