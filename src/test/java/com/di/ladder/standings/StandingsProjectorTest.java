package com.di.ladder.standings;

import com.di.ladder.kind.CombatantKind;
import com.di.ladder.model.Combatant;
import com.di.ladder.model.StandingEntry;
import com.di.ladder.model.StandingsPage;
import com.di.ladder.model.Tier;
import com.di.ladder.store.InMemoryLadderStore;
import com.di.ladder.support.LadderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static com.di.ladder.support.LadderFixtures.combatant;
import static com.di.ladder.support.LadderFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("StandingsProjector Tests")
class StandingsProjectorTest {

    private InMemoryLadderStore<Combatant> store;
    private StandingsProjector<Combatant> projector;

    @BeforeEach
    void setUp() {
        CombatantKind kind = new CombatantKind(100);
        store = LadderFixtures.combatantStore(kind);
        projector = new StandingsProjector<>(kind, store, 50, 100);
    }

    @Test
    @DisplayName("Should rank by points, then rating, then id with 1-based ranks")
    void testRankingOrder() {
        Combatant first = store.insert(combatant("a", Tier.GOLD, 1, 90, 1000, 0));
        Combatant third = store.insert(combatant("b", Tier.GOLD, 1, 70, 1500, 0));
        Combatant second = store.insert(combatant("c", Tier.GOLD, 2, 70, 1600, 0));
        Combatant fourth = store.insert(combatant("d", Tier.GOLD, 2, 70, 1500, 0));

        List<StandingEntry<Combatant>> ranked = projector.rank(Tier.GOLD, null);

        assertEquals(List.of(first.getId(), second.getId(), third.getId(), fourth.getId()),
                ranked.stream().map(StandingEntry::getEntityId).collect(Collectors.toList()));
        assertEquals(List.of(1, 2, 3, 4),
                ranked.stream().map(StandingEntry::getRank).collect(Collectors.toList()));
        assertEquals("gold_2", ranked.get(1).getInstance().toString());
    }

    @Test
    @DisplayName("Should limit standings to one instance when requested")
    void testInstanceFilter() {
        seed(store, Tier.GOLD, 1, 4, i -> i);
        seed(store, Tier.GOLD, 2, 3, i -> 100 + i);

        List<StandingEntry<Combatant>> ranked = projector.rank(Tier.GOLD, 2);

        assertEquals(3, ranked.size());
        assertEquals(102, ranked.get(0).getPoints());
        assertEquals(1, ranked.get(0).getRank());
    }

    @Test
    @DisplayName("Should continue ranks across pages")
    void testPaging() {
        seed(store, Tier.SILVER, 1, 7, i -> i);

        StandingsPage<Combatant> page = projector.page(Tier.SILVER, null, 2, 3);

        assertEquals(List.of(4, 5, 6),
                page.getEntries().stream().map(StandingEntry::getRank).collect(Collectors.toList()));
        assertEquals(List.of(3, 2, 1),
                page.getEntries().stream().map(StandingEntry::getPoints).collect(Collectors.toList()));
        assertEquals(7, page.getTotal());
        assertEquals(3, page.getTotalPages());
        assertEquals(2, page.getPage());
    }

    @Test
    @DisplayName("Should return an empty page past the end")
    void testPagePastEnd() {
        seed(store, Tier.SILVER, 1, 7, i -> i);

        StandingsPage<Combatant> page = projector.page(Tier.SILVER, null, 4, 3);

        assertTrue(page.getEntries().isEmpty());
        assertEquals(7, page.getTotal());
    }

    @Test
    @DisplayName("Should clamp page size and page number")
    void testClamping() {
        assertEquals(100, projector.clampPageSize(500));
        assertEquals(1, projector.clampPageSize(0));
        assertEquals(50, projector.clampPageSize(null));

        seed(store, Tier.BRONZE, 1, 3, i -> i);
        StandingsPage<Combatant> page = projector.page(Tier.BRONZE, null, 0, null);
        assertEquals(1, page.getPage());
        assertEquals(50, page.getPerPage());
        assertEquals(3, page.getEntries().size());
    }

    @Test
    @DisplayName("Should leave placeholders out of the standings")
    void testPlaceholdersExcluded() {
        seed(store, Tier.BRONZE, 1, 2, i -> i);
        store.insert(combatant("pad", Tier.BRONZE, 1, 999, 0, 0).toBuilder().placeholder(true).build());

        assertEquals(2, projector.rank(Tier.BRONZE, null).size());
    }
}
