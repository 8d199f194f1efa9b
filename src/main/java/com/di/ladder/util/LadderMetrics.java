package com.di.ladder.util;

import com.di.ladder.model.RebalanceOperation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters for one entity kind's ladder: admissions, moves, failures, redistributions
 * and run duration. All meters carry a {@code kind} tag.
 */
@Slf4j
public class LadderMetrics {

    private final MeterRegistry meterRegistry;
    private final String kind;

    private final Counter admissionsExisting;
    private final Counter admissionsNewInstance;
    private final Counter admissionRetries;
    private final Counter promotions;
    private final Counter demotions;
    private final Counter redistributions;
    private final DistributionSummary relocatedPerRedistribution;
    private final Timer runTimer;

    public LadderMetrics(MeterRegistry meterRegistry, String kind) {
        this.meterRegistry = meterRegistry;
        this.kind = kind;

        this.admissionsExisting = Counter.builder("ladder.admissions.total")
                .description("Entities admitted to a tier instance")
                .tag("kind", kind)
                .tag("instance", "existing")
                .register(meterRegistry);

        this.admissionsNewInstance = Counter.builder("ladder.admissions.total")
                .description("Entities admitted to a tier instance")
                .tag("kind", kind)
                .tag("instance", "new")
                .register(meterRegistry);

        this.admissionRetries = Counter.builder("ladder.admissions.retries")
                .description("Admissions retried after tier lock contention")
                .tag("kind", kind)
                .register(meterRegistry);

        this.promotions = Counter.builder("ladder.moves.total")
                .description("Tier moves executed")
                .tag("kind", kind)
                .tag("direction", "promotion")
                .register(meterRegistry);

        this.demotions = Counter.builder("ladder.moves.total")
                .description("Tier moves executed")
                .tag("kind", kind)
                .tag("direction", "demotion")
                .register(meterRegistry);

        this.redistributions = Counter.builder("ladder.redistributions.total")
                .description("Tier redistributions performed")
                .tag("kind", kind)
                .register(meterRegistry);

        this.relocatedPerRedistribution = DistributionSummary.builder("ladder.redistributions.relocated")
                .description("Entities whose instance changed in one redistribution")
                .tag("kind", kind)
                .baseUnit("entities")
                .register(meterRegistry);

        this.runTimer = Timer.builder("ladder.rebalance.duration")
                .description("Time taken by one full rebalancing run")
                .tag("kind", kind)
                .register(meterRegistry);
    }

    public void recordAdmission(boolean newInstance) {
        (newInstance ? admissionsNewInstance : admissionsExisting).increment();
    }

    public void recordAdmissionRetry() {
        admissionRetries.increment();
    }

    public void recordPromotion() {
        promotions.increment();
    }

    public void recordDemotion() {
        demotions.increment();
    }

    public void recordFailure(RebalanceOperation operation) {
        Counter.builder("ladder.rebalance.failures")
                .description("Failures absorbed by rebalancing runs")
                .tag("kind", kind)
                .tag("operation", operation.name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    public void recordRedistribution(int relocated) {
        redistributions.increment();
        relocatedPerRedistribution.record(relocated);
    }

    public void recordRun(long durationMs) {
        runTimer.record(durationMs, TimeUnit.MILLISECONDS);
        log.debug("Recorded {} rebalance run: durationMs={}", kind, durationMs);
    }
}
