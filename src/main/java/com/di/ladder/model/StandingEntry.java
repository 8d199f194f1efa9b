package com.di.ladder.model;

import lombok.Value;

/**
 * One ranked row of a standings table.
 */
@Value
public class StandingEntry<E> {
    /** 1-based position. */
    int rank;
    long entityId;
    InstanceId instance;
    int points;
    int rating;
    E entity;
}
