package uk.gegc.videobatch.features.scheduler.application;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Micrometer meters of the generation pipeline.
 */
@Component
public class SchedulerMetrics {

    private final MeterRegistry meterRegistry;

    private final Counter claimsWonCounter;
    private final Counter claimsLostCounter;
    private final Counter tasksCompletedCounter;
    private final Counter refundsIssuedCounter;
    private final Counter resultsDroppedCounter;

    public SchedulerMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.claimsWonCounter = Counter.builder("generation.claims.won")
                .description("Number of tasks claimed by the scheduler")
                .register(meterRegistry);
        this.claimsLostCounter = Counter.builder("generation.claims.lost")
                .description("Number of claims that affected zero rows")
                .register(meterRegistry);
        this.tasksCompletedCounter = Counter.builder("generation.tasks.completed")
                .description("Number of tasks that finished with a result")
                .register(meterRegistry);
        this.refundsIssuedCounter = Counter.builder("generation.refunds.issued")
                .description("Number of refund transactions written for failed tasks")
                .register(meterRegistry);
        this.resultsDroppedCounter = Counter.builder("generation.results.dropped")
                .description("Results discarded because the task had left running")
                .register(meterRegistry);
    }

    public void bindSchedulerState(Supplier<Number> queueDepth, Supplier<Number> globalInFlight) {
        Gauge.builder("generation.queue.depth", queueDepth)
                .description("Task ids waiting in the scheduler queue")
                .register(meterRegistry);
        Gauge.builder("generation.inflight", globalInFlight)
                .description("Tasks currently executing")
                .register(meterRegistry);
    }

    public void recordClaimWon() {
        claimsWonCounter.increment();
    }

    public void recordClaimLost() {
        claimsLostCounter.increment();
    }

    public void recordOutcome(ExecutionOutcome outcome) {
        if (outcome.isSuccess()) {
            tasksCompletedCounter.increment();
            return;
        }
        meterRegistry.counter("generation.tasks.failed", "kind", outcome.errorKind().name()).increment();
    }

    public void recordRefund() {
        refundsIssuedCounter.increment();
    }

    public void recordResultDropped() {
        resultsDroppedCounter.increment();
    }

    public void recordReconcilerCorrection(String rule) {
        meterRegistry.counter("generation.reconciler.corrections", "rule", rule).increment();
    }
}
