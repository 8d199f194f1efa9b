package com.di.ladder.rebalance;

import com.di.ladder.exception.BoundaryTierViolationException;
import com.di.ladder.exception.EntityNotFoundException;
import com.di.ladder.instance.InstanceAssigner;
import com.di.ladder.instance.InstanceDirectory;
import com.di.ladder.kind.CombatantKind;
import com.di.ladder.model.Combatant;
import com.di.ladder.model.Placement;
import com.di.ladder.model.RebalanceOperation;
import com.di.ladder.model.Tier;
import com.di.ladder.store.InMemoryLadderStore;
import com.di.ladder.support.LadderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.di.ladder.support.LadderFixtures.combatant;
import static com.di.ladder.support.LadderFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("TierTransitioner Tests")
class TierTransitionerTest {

    private InMemoryLadderStore<Combatant> store;
    private TierTransitioner<Combatant> transitioner;

    @BeforeEach
    void setUp() {
        CombatantKind kind = new CombatantKind(5);
        store = LadderFixtures.combatantStore(kind);
        InstanceAssigner<Combatant> assigner = new InstanceAssigner<>(kind, store,
                new InstanceDirectory<>(kind, store), LadderFixtures.metrics(kind));
        transitioner = new TierTransitioner<>(kind, store, assigner, LadderFixtures.metrics(kind));
    }

    @Test
    @DisplayName("Should keep points and reset cycles-in-tier on promotion")
    void testPromote_KeepsPoints() {
        Combatant c = store.insert(combatant("ace", Tier.SILVER, 1, 50, 1200, 9));

        Placement placement = transitioner.promote(c.getId());

        Combatant moved = store.findById(c.getId()).orElseThrow();
        assertEquals(Tier.GOLD, moved.getTier());
        assertEquals(50, moved.getPoints());
        assertEquals(1200, moved.getRating());
        assertEquals(0, moved.getCyclesInTier());
        assertEquals(Tier.SILVER, placement.getFromTier());
        assertEquals("gold_1", placement.getDestination().toString());
        assertEquals(50, placement.getPoints());
    }

    @Test
    @DisplayName("Should place a demoted entity in the lower tier")
    void testDemote() {
        Combatant c = store.insert(combatant("slump", Tier.PLATINUM, 1, 3, 900, 7));

        Placement placement = transitioner.demote(c.getId());

        assertEquals(Tier.DIAMOND.predecessor().orElseThrow(), placement.getToTier());
        assertEquals(Tier.GOLD, store.findById(c.getId()).orElseThrow().getTier());
    }

    @Test
    @DisplayName("Should reject promotion from the top tier")
    void testPromote_TopTier() {
        Combatant c = store.insert(combatant("king", Tier.CHAMPION, 1, 999, 2000, 10));

        BoundaryTierViolationException ex = assertThrows(BoundaryTierViolationException.class,
                () -> transitioner.promote(c.getId()));

        assertEquals(RebalanceOperation.PROMOTION, ex.getOperation());
        assertEquals(Tier.CHAMPION, ex.getTier());
        assertEquals(Tier.CHAMPION, store.findById(c.getId()).orElseThrow().getTier());
    }

    @Test
    @DisplayName("Should reject demotion from the bottom tier")
    void testDemote_BottomTier() {
        Combatant c = store.insert(combatant("rookie", Tier.BRONZE, 1, 0, 800, 10));

        BoundaryTierViolationException ex = assertThrows(BoundaryTierViolationException.class,
                () -> transitioner.demote(c.getId()));

        assertEquals(RebalanceOperation.DEMOTION, ex.getOperation());
        assertEquals(c.getId(), ex.getEntityId());
    }

    @Test
    @DisplayName("Should open a new destination instance when the existing one is full")
    void testMove_IntoFullTier() {
        seed(store, Tier.GOLD, 1, 5, i -> 0);
        Combatant c = store.insert(combatant("climber", Tier.SILVER, 1, 60, 1000, 5));

        Placement placement = transitioner.promote(c.getId());

        assertEquals(2, placement.getToInstance());
        assertEquals(5, store.countMembersByInstance(Tier.GOLD).get(1));
    }

    @Test
    @DisplayName("Should move across several tiers on request")
    void testMoveToTier_Jump() {
        Combatant c = store.insert(combatant("wildcard", Tier.BRONZE, 1, 12, 1000, 2));

        Placement placement = transitioner.moveToTier(c.getId(), Tier.DIAMOND);

        assertEquals(Tier.BRONZE, placement.getFromTier());
        assertEquals(Tier.DIAMOND, store.findById(c.getId()).orElseThrow().getTier());
        assertEquals(12, store.findById(c.getId()).orElseThrow().getPoints());
    }

    @Test
    @DisplayName("Should leave the entity untouched when moving to its current tier")
    void testMoveToTier_SameTier() {
        Combatant c = store.insert(combatant("stay", Tier.GOLD, 1, 12, 1000, 8));

        Placement placement = transitioner.moveToTier(c.getId(), Tier.GOLD);

        assertEquals(placement.getFromInstance(), placement.getToInstance());
        assertEquals(8, store.findById(c.getId()).orElseThrow().getCyclesInTier());
    }

    @Test
    @DisplayName("Should fail for an unknown entity")
    void testMoveToTier_Unknown() {
        assertThrows(EntityNotFoundException.class, () -> transitioner.moveToTier(4242L, Tier.GOLD));
    }
}
