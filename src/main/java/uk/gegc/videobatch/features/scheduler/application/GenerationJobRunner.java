package uk.gegc.videobatch.features.scheduler.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import uk.gegc.videobatch.features.remote.application.RemoteJobClient;
import uk.gegc.videobatch.features.scheduler.config.SchedulerProperties;

import java.time.Clock;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Starts an execution unit for a claimed task and persists whatever it produces.
 */
@Slf4j
@Component
public class GenerationJobRunner {

    private final RemoteJobClient remoteJobClient;
    private final TaskLifecycleService lifecycle;
    private final SchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final TaskScheduler timer;
    private final Executor workers;
    private final Clock clock;

    public GenerationJobRunner(RemoteJobClient remoteJobClient,
                               TaskLifecycleService lifecycle,
                               SchedulerProperties properties,
                               SchedulerMetrics metrics,
                               @Qualifier("generationTimer") TaskScheduler timer,
                               @Qualifier("generationTaskExecutor") Executor workers,
                               Clock clock) {
        this.remoteJobClient = remoteJobClient;
        this.lifecycle = lifecycle;
        this.properties = properties;
        this.metrics = metrics;
        this.timer = timer;
        this.workers = workers;
        this.clock = clock;
    }

    /**
     * @return completes once the outcome is persisted; completes exceptionally only if persisting failed
     */
    public CompletableFuture<ExecutionOutcome> run(ClaimedTask task) {
        TaskExecutionUnit unit = new TaskExecutionUnit(task, remoteJobClient, lifecycle, timer, workers,
                properties.getPollInterval(), properties.getMaxPollDuration(), clock);

        return unit.start()
                .handle((outcome, error) -> {
                    if (error == null) {
                        return outcome;
                    }
                    log.error("Unexpected fault while executing task {} (owner {})", task.taskId(), task.ownerId(), error);
                    return ExecutionOutcome.failure(ExecutionErrorKind.PROVIDER_ERROR,
                            "Unexpected error: " + error.getClass().getSimpleName());
                })
                .thenApplyAsync(outcome -> {
                    lifecycle.finish(task, outcome);
                    metrics.recordOutcome(outcome);
                    return outcome;
                }, workers);
    }
}
