package com.di.ladder.rebalance;

import com.di.ladder.kind.CombatantKind;
import com.di.ladder.model.Combatant;
import com.di.ladder.model.Tier;
import com.di.ladder.store.InMemoryLadderStore;
import com.di.ladder.support.LadderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static com.di.ladder.support.LadderFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DemotionSelector Tests")
class DemotionSelectorTest {

    private InMemoryLadderStore<Combatant> store;
    private DemotionSelector<Combatant> selector;

    @BeforeEach
    void setUp() {
        CombatantKind kind = new CombatantKind(100);
        store = LadderFixtures.combatantStore(kind);
        selector = new DemotionSelector<>(kind, store, 0.10, 5, 10);
    }

    @Test
    @DisplayName("Should select the bottom 10% of a middle tier")
    void testBottomPercentile() {
        seed(store, Tier.SILVER, 1, 20, i -> i * 10);

        List<Combatant> selected = selector.select(Tier.SILVER, 1, Set.of());

        assertEquals(List.of(0, 10), points(selected));
    }

    @Test
    @DisplayName("Should demote regardless of the promotion points gate")
    void testNoPointsGate() {
        seed(store, Tier.GOLD, 1, 20, i -> i);

        assertEquals(List.of(0, 1), points(selector.select(Tier.GOLD, 1, Set.of())));
    }

    @Test
    @DisplayName("Should never demote out of the bottom tier")
    void testBottomTier() {
        seed(store, Tier.BRONZE, 1, 20, i -> i * 10);

        assertTrue(selector.select(Tier.BRONZE, 1, Set.of()).isEmpty());
    }

    @Test
    @DisplayName("Should demote from the top tier")
    void testTopTier() {
        seed(store, Tier.CHAMPION, 1, 20, i -> i * 10);

        assertEquals(2, selector.select(Tier.CHAMPION, 1, Set.of()).size());
    }

    @Test
    @DisplayName("Should break point ties by lowest rating first")
    void testTieBreak() {
        seed(store, Tier.SILVER, 1, 18, i -> 100);
        Combatant weak = store.insert(LadderFixtures.combatant("weak", Tier.SILVER, 1, 5, 800, 5));
        Combatant weaker = store.insert(LadderFixtures.combatant("weaker", Tier.SILVER, 1, 5, 700, 5));

        List<Combatant> selected = selector.select(Tier.SILVER, 1, Set.of());

        assertEquals(List.of(weaker.getId(), weak.getId()),
                selected.stream().map(Combatant::getId).collect(Collectors.toList()));
    }

    private static List<Integer> points(List<Combatant> combatants) {
        return combatants.stream().map(Combatant::getPoints).collect(Collectors.toList());
    }
}
