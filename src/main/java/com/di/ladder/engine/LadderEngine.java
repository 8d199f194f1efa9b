package com.di.ladder.engine;

import com.di.ladder.config.LadderProperties;
import com.di.ladder.exception.AssignmentContentionException;
import com.di.ladder.instance.InstanceAssigner;
import com.di.ladder.instance.InstanceDirectory;
import com.di.ladder.instance.RebalanceDetector;
import com.di.ladder.instance.Redistributor;
import com.di.ladder.kind.EntityKind;
import com.di.ladder.model.InstanceId;
import com.di.ladder.model.InstanceOccupancy;
import com.di.ladder.model.Placement;
import com.di.ladder.model.RebalancingSummary;
import com.di.ladder.model.RedistributionResult;
import com.di.ladder.model.StandingEntry;
import com.di.ladder.model.StandingsPage;
import com.di.ladder.model.Tier;
import com.di.ladder.model.TierStats;
import com.di.ladder.rebalance.DemotionSelector;
import com.di.ladder.rebalance.PromotionSelector;
import com.di.ladder.rebalance.RebalanceOrchestrator;
import com.di.ladder.rebalance.TierTransitioner;
import com.di.ladder.standings.StandingsProjector;
import com.di.ladder.store.LadderStore;
import com.di.ladder.util.LadderMetrics;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for one entity kind. Wires the ladder components over a single store and exposes
 * the operations collaborators call: admission, tier moves, full rebalancing runs, standings.
 * <p>
 * Admissions that lose the tier lock race are retried up to {@code ladder.admission.max-attempts}
 * times before the {@link AssignmentContentionException} is surfaced.
 */
@Slf4j
public class LadderEngine<E> {

    private final EntityKind<E> kind;
    private final LadderStore<E> store;
    private final InstanceDirectory<E> directory;
    private final InstanceAssigner<E> assigner;
    private final RebalanceDetector<E> detector;
    private final Redistributor<E> redistributor;
    private final TierTransitioner<E> transitioner;
    private final RebalanceOrchestrator<E> orchestrator;
    private final StandingsProjector<E> standings;
    private final LadderMetrics metrics;
    private final int maxAdmissionAttempts;

    LadderEngine(EntityKind<E> kind, LadderStore<E> store, InstanceDirectory<E> directory,
                 InstanceAssigner<E> assigner, RebalanceDetector<E> detector, Redistributor<E> redistributor,
                 TierTransitioner<E> transitioner, RebalanceOrchestrator<E> orchestrator,
                 StandingsProjector<E> standings, LadderMetrics metrics, int maxAdmissionAttempts) {
        this.kind = kind;
        this.store = store;
        this.directory = directory;
        this.assigner = assigner;
        this.detector = detector;
        this.redistributor = redistributor;
        this.transitioner = transitioner;
        this.orchestrator = orchestrator;
        this.standings = standings;
        this.metrics = metrics;
        this.maxAdmissionAttempts = Math.max(1, maxAdmissionAttempts);
    }

    /**
     * Builds an engine for {@code kind} with every component configured from {@code properties}.
     */
    public static <E> LadderEngine<E> assemble(EntityKind<E> kind, LadderStore<E> store,
                                               LadderProperties properties, LadderMetrics metrics) {
        LadderProperties.Rebalance rebalance = properties.getRebalance();

        InstanceDirectory<E> directory = new InstanceDirectory<>(kind, store);
        InstanceAssigner<E> assigner = new InstanceAssigner<>(kind, store, directory, metrics);
        RebalanceDetector<E> detector = new RebalanceDetector<>(kind, directory,
                properties.getInstances().getDeviationThreshold());
        Redistributor<E> redistributor = new Redistributor<>(kind, store, detector, metrics);
        TierTransitioner<E> transitioner = new TierTransitioner<>(kind, store, assigner, metrics);
        PromotionSelector<E> promotionSelector = new PromotionSelector<>(kind, store,
                rebalance.getPromotionFraction(), rebalance.getMinCyclesInTier(),
                rebalance.getMinEligiblePerInstance(), rebalance.getMinPointsForPromotion());
        DemotionSelector<E> demotionSelector = new DemotionSelector<>(kind, store,
                rebalance.getDemotionFraction(), rebalance.getMinCyclesInTier(),
                rebalance.getMinEligiblePerInstance());
        RebalanceOrchestrator<E> orchestrator = new RebalanceOrchestrator<>(kind, store, directory,
                promotionSelector, demotionSelector, transitioner, detector, redistributor, metrics);
        StandingsProjector<E> standings = new StandingsProjector<>(kind, store,
                properties.getStandings().getDefaultPageSize(), properties.getStandings().getMaxPageSize());

        log.info("[ENGINE] {} ladder ready: capacity={}, promotion={}, demotion={}, minCycles={}, minEligible={}, "
                        + "minPoints={}, deviationThreshold={}",
                kind.name(), kind.capacity(), rebalance.getPromotionFraction(), rebalance.getDemotionFraction(),
                rebalance.getMinCyclesInTier(), rebalance.getMinEligiblePerInstance(),
                rebalance.getMinPointsForPromotion(), properties.getInstances().getDeviationThreshold());

        return new LadderEngine<>(kind, store, directory, assigner, detector, redistributor, transitioner,
                orchestrator, standings, metrics, properties.getAdmission().getMaxAttempts());
    }

    public EntityKind<E> kind() {
        return kind;
    }

    /**
     * Instance a new member of {@code tier} should join. The caller creates the record itself; use
     * {@link #admit(Object)} to create it under the same lock.
     */
    public InstanceId assignInitialInstance(Tier tier) {
        int number = withContentionRetry(tier, () -> assigner.assign(tier));
        return InstanceId.of(tier, number);
    }

    /**
     * Creates {@code draft} in its tier and assigns its instance in one locked transaction.
     * Any instance number already set on the draft is ignored.
     */
    public E admit(E draft) {
        Tier tier = kind.tierOf(draft);
        if (tier == null) {
            throw new IllegalArgumentException("New " + kind.name() + " must have a tier");
        }
        return withContentionRetry(tier, () -> assigner.admit(draft, tier));
    }

    public Placement moveToTier(long entityId, Tier targetTier) {
        return transitioner.moveToTier(entityId, targetTier);
    }

    public Placement promote(long entityId) {
        return transitioner.promote(entityId);
    }

    public Placement demote(long entityId) {
        return transitioner.demote(entityId);
    }

    public RebalancingSummary runFullCycle(long cycleNumber) {
        return orchestrator.runFullCycle(cycleNumber);
    }

    /** Adds one cycle to cycles-in-tier of every entity; called once per competitive period. */
    public int advanceCycle() {
        int updated = store.incrementCyclesInTier();
        log.info("[ENGINE] Advanced cycles-in-tier for {} {}(s)", updated, kind.name());
        return updated;
    }

    public List<StandingEntry<E>> getStandings(Tier tier) {
        return standings.rank(tier, null);
    }

    public List<StandingEntry<E>> getStandings(InstanceId instance) {
        return standings.rank(instance.getTier(), instance.getNumber());
    }

    public StandingsPage<E> getStandings(Tier tier, Integer instanceNumber, int page, Integer perPage) {
        return standings.page(tier, instanceNumber, page, perPage);
    }

    public List<InstanceOccupancy> listInstances(Tier tier) {
        return directory.listInstances(tier);
    }

    public TierStats stats(Tier tier) {
        return detector.stats(tier);
    }

    /** Redistributes {@code tier} on demand; skipped when the tier is balanced. */
    public RedistributionResult redistribute(Tier tier) {
        return redistributor.redistribute(tier);
    }

    private <T> T withContentionRetry(Tier tier, Supplier<T> admission) {
        AssignmentContentionException last = null;
        for (int attempt = 1; attempt <= maxAdmissionAttempts; attempt++) {
            try {
                return admission.get();
            } catch (AssignmentContentionException e) {
                last = e;
                if (attempt < maxAdmissionAttempts) {
                    metrics.recordAdmissionRetry();
                    log.warn("[ASSIGNER] {} admission to {} contended (attempt {}/{}): {}",
                            kind.name(), tier.key(), attempt, maxAdmissionAttempts, e.getMessage());
                }
            }
        }
        log.error("[ASSIGNER] {} admission to {} failed after {} attempts", kind.name(), tier.key(), maxAdmissionAttempts);
        throw last;
    }
}
