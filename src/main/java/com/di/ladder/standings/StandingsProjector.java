package com.di.ladder.standings;

import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceId;
import com.di.ladder.model.StandingEntry;
import com.di.ladder.model.StandingsPage;
import com.di.ladder.model.Tier;
import com.di.ladder.store.LadderStore;

import java.util.ArrayList;
import java.util.List;

/**
 * Read-only ranked view of a tier or of one of its instances: points desc, rating desc, id asc.
 * Ranks are 1-based and continue across pages.
 */
public class StandingsProjector<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final int defaultPageSize;
    private final int maxPageSize;

    public StandingsProjector(EntityKind<E> kind, LadderStore<E> store, int defaultPageSize, int maxPageSize) {
        this.kind = kind;
        this.store = store;
        this.defaultPageSize = defaultPageSize;
        this.maxPageSize = maxPageSize;
    }

    /** Every member of the tier (or instance when {@code instanceNumber} is not null), ranked. */
    public List<StandingEntry<E>> rank(Tier tier, Integer instanceNumber) {
        List<E> members = new ArrayList<>(instanceNumber == null
                ? store.findByTier(tier)
                : store.findByInstance(tier, instanceNumber));
        members.sort(kind.rankingOrder());
        List<StandingEntry<E>> entries = new ArrayList<>(members.size());
        for (int i = 0; i < members.size(); i++) {
            entries.add(entry(i + 1, members.get(i)));
        }
        return entries;
    }

    /**
     * One page of the ranking. {@code page} below 1 reads page 1; {@code perPage} is clamped to
     * {@code [1, maxPageSize]} and defaults when null.
     */
    public StandingsPage<E> page(Tier tier, Integer instanceNumber, int page, Integer perPage) {
        int size = clampPageSize(perPage);
        int current = Math.max(page, 1);
        List<StandingEntry<E>> ranked = rank(tier, instanceNumber);

        long offset = (long) (current - 1) * size;
        List<StandingEntry<E>> entries = offset >= ranked.size()
                ? List.of()
                : List.copyOf(ranked.subList((int) offset, (int) Math.min(offset + size, ranked.size())));

        return StandingsPage.<E>builder()
                .tier(tier)
                .instanceNumber(instanceNumber)
                .entries(entries)
                .page(current)
                .perPage(size)
                .total(ranked.size())
                .build();
    }

    int clampPageSize(Integer perPage) {
        if (perPage == null) {
            return Math.min(defaultPageSize, maxPageSize);
        }
        return Math.max(1, Math.min(perPage, maxPageSize));
    }

    private StandingEntry<E> entry(int rank, E e) {
        return new StandingEntry<>(rank, kind.idOf(e), InstanceId.of(kind.tierOf(e), kind.instanceOf(e)),
                kind.pointsOf(e), kind.ratingOf(e), e);
    }
}
