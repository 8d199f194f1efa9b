package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

/**
 * An individual combatant on the ladder.
 */
@Value
@Builder(toBuilder = true)
public class Combatant {
    /** Store-assigned identity; 0 until persisted. */
    long id;
    String name;
    Tier tier;
    int instanceNumber;
    /** League points. Kept across tier changes. */
    int points;
    /** Skill rating, only used to break ties on points. */
    int rating;
    /** Cycles spent in the current tier; reset on every tier change. */
    int cyclesInTier;
    /** Synthetic filler used to pad unmatched pairings; never counted or ranked. */
    boolean placeholder;
}
