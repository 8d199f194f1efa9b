package com.di.ladder.rebalance;

import com.di.ladder.engine.LadderEngine;
import com.di.ladder.exception.ErrorCategory;
import com.di.ladder.kind.CombatantKind;
import com.di.ladder.model.Combatant;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.RebalanceError;
import com.di.ladder.model.RebalanceOperation;
import com.di.ladder.model.RebalancingSummary;
import com.di.ladder.model.Tier;
import com.di.ladder.model.TierSummary;
import com.di.ladder.store.InMemoryLadderStore;
import com.di.ladder.support.LadderFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static com.di.ladder.support.LadderFixtures.seed;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("RebalanceOrchestrator Tests")
class RebalanceOrchestratorTest {

    private CombatantKind kind;
    private InMemoryLadderStore<Combatant> store;
    private LadderEngine<Combatant> engine;

    @BeforeEach
    void setUp() {
        kind = new CombatantKind(100);
        store = LadderFixtures.combatantStore(kind);
        engine = LadderFixtures.engine(kind, store);
    }

    @Test
    @DisplayName("Should promote the top 10% and split the rest of a single oversized instance")
    void testOversizedInstance() {
        seed(store, Tier.BRONZE, 1, 331, i -> i);

        RebalancingSummary summary = engine.runFullCycle(1);

        assertEquals(33, summary.getTotalPromoted());
        assertEquals(0, summary.getTotalDemoted());
        assertEquals(33, store.countInTier(Tier.SILVER));

        List<InstanceOccupancy> bronze = engine.listInstances(Tier.BRONZE);
        assertEquals(3, bronze.size());
        assertEquals(298, bronze.stream().mapToInt(InstanceOccupancy::getMemberCount).sum());
        assertTrue(bronze.stream().allMatch(i -> i.getMemberCount() <= 100));

        assertEquals(1, summary.getRedistributions().size());
        assertEquals(Tier.BRONZE, summary.getRedistributions().get(0).getTier());
        assertFalse(summary.hasErrors());
    }

    @Test
    @DisplayName("Should leave an uneven tier alone when no instance is over capacity")
    void testDeviationOnlyNotRedistributed() {
        seed(store, Tier.SILVER, 1, 80, i -> i, 0);
        seed(store, Tier.SILVER, 2, 20, i -> i, 0);
        assertTrue(engine.stats(Tier.SILVER).isNeedsRebalancing());

        RebalancingSummary summary = engine.runFullCycle(2);

        assertTrue(summary.getRedistributions().isEmpty());
        Map<Integer, Integer> counts = store.countMembersByInstance(Tier.SILVER);
        assertEquals(80, counts.get(1));
        assertEquals(20, counts.get(2));
    }

    @Test
    @DisplayName("Should move every entity at most once per run")
    void testNoDoubleMove() {
        List<Combatant> seeded = new ArrayList<>();
        seeded.addAll(seed(store, Tier.BRONZE, 1, 20, i -> i * 10));
        seeded.addAll(seed(store, Tier.SILVER, 1, 20, i -> i * 10));
        seeded.addAll(seed(store, Tier.GOLD, 1, 20, i -> i * 10));
        Map<Long, Tier> before = new HashMap<>();
        seeded.forEach(c -> before.put(c.getId(), c.getTier()));

        RebalancingSummary summary = engine.runFullCycle(3);

        int moved = 0;
        for (Map.Entry<Long, Tier> e : before.entrySet()) {
            Tier after = store.findById(e.getKey()).orElseThrow().getTier();
            assertTrue(Math.abs(after.ordinal() - e.getValue().ordinal()) <= 1, "moved twice: " + e.getKey());
            if (after != e.getValue()) {
                moved++;
            }
        }
        // bronze: 2 up; silver: 2 up, 2 down; gold: 2 up, 2 down
        assertEquals(6, summary.getTotalPromoted());
        assertEquals(4, summary.getTotalDemoted());
        assertEquals(10, moved);
    }

    @Test
    @DisplayName("Should keep newly promoted entities in their new tier")
    void testPromotedNotDemotedBack() {
        List<Combatant> bronze = seed(store, Tier.BRONZE, 1, 20, i -> i * 10);
        seed(store, Tier.SILVER, 1, 20, i -> 1000 + i);

        engine.runFullCycle(4);

        assertEquals(Tier.SILVER, store.findById(bronze.get(19).getId()).orElseThrow().getTier());
        assertEquals(Tier.SILVER, store.findById(bronze.get(18).getId()).orElseThrow().getTier());
    }

    @Test
    @DisplayName("Should record a failed move and continue with the rest")
    void testFailureTolerance() {
        FailingStore failing = new FailingStore(kind);
        LadderEngine<Combatant> failingEngine = LadderFixtures.engine(kind, failing);
        List<Combatant> seeded = seed(failing, Tier.BRONZE, 1, 20, i -> i * 10);
        failing.failOn = seeded.get(19).getId();

        RebalancingSummary summary = failingEngine.runFullCycle(5);

        assertEquals(1, summary.getTotalPromoted());
        assertEquals(1, summary.getErrors().size());
        RebalanceError error = summary.getErrors().get(0);
        assertEquals(seeded.get(19).getId(), error.getEntityId());
        assertEquals(RebalanceOperation.PROMOTION, error.getOperation());
        assertEquals(ErrorCategory.STORAGE_ERROR, error.getCategory());
        assertEquals(Tier.BRONZE, failing.findById(seeded.get(19).getId()).orElseThrow().getTier());
        assertEquals(Tier.SILVER, failing.findById(seeded.get(18).getId()).orElseThrow().getTier());
    }

    @Test
    @DisplayName("Should report cycle, kind, totals and per-tier detail")
    void testSummaryDetail() {
        seed(store, Tier.GOLD, 1, 30, i -> i * 10);

        RebalancingSummary summary = engine.runFullCycle(42);

        assertEquals(42, summary.getCycleNumber());
        assertEquals("combatant", summary.getEntityKind());
        assertEquals(30, summary.getTotalEntities());
        assertEquals(Tier.values().length, summary.getTierSummaries().size());
        TierSummary gold = summary.getTierSummaries().get(Tier.GOLD.ordinal());
        assertEquals(30, gold.getEntitiesInTier());
        assertEquals(30, gold.getEligible());
        assertEquals(3, gold.getPromoted());
        assertEquals(3, gold.getDemoted());
        assertFalse(summary.getFinishedAt().isBefore(summary.getStartedAt()));
    }

    @Test
    @DisplayName("Should restore the caller's MDC after the run")
    void testMdcRestored() {
        MDC.put("requestId", "r-1");
        try {
            engine.runFullCycle(7);
            assertEquals("r-1", MDC.get("requestId"));
            assertNull(MDC.get(RebalanceOrchestrator.MDC_CYCLE_NUMBER));
            assertNull(MDC.get(RebalanceOrchestrator.MDC_ENTITY_KIND));
        } finally {
            MDC.clear();
        }
    }

    /** Store whose placement writes fail for one entity. */
    private static final class FailingStore extends InMemoryLadderStore<Combatant> {

        long failOn = -1;

        FailingStore(CombatantKind kind) {
            super(kind, LadderFixtures.LOCK_TIMEOUT);
        }

        @Override
        public void updatePlacement(long id, Tier tier, int instanceNumber) {
            if (id == failOn) {
                throw new DataAccessResourceFailureException("storage unavailable for " + id);
            }
            super.updatePlacement(id, tier, instanceNumber);
        }
    }
}
