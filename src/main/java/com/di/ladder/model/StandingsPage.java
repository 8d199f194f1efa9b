package com.di.ladder.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * A page of standings for a tier, or for one instance when {@code instanceNumber} is set.
 */
@Value
@Builder
public class StandingsPage<E> {
    Tier tier;
    Integer instanceNumber;
    List<StandingEntry<E>> entries;
    int page;
    int perPage;
    long total;

    public int getTotalPages() {
        return perPage <= 0 ? 0 : (int) ((total + perPage - 1) / perPage);
    }
}
