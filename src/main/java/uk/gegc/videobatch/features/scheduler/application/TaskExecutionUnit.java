package uk.gegc.videobatch.features.scheduler.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.remote.application.RemoteJobClient;
import uk.gegc.videobatch.features.remote.application.RemoteJobHandle;
import uk.gegc.videobatch.features.remote.application.RemoteJobRequest;
import uk.gegc.videobatch.features.remote.application.RemoteJobSnapshot;
import uk.gegc.videobatch.features.remote.application.RemoteJobStatus;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * One execution attempt of a claimed task.
 *
 * <p>No thread is held while waiting: each poll is a one-shot timer on the shared
 * {@link TaskScheduler} that hands the blocking provider call to the worker executor.
 * The returned future completes with an {@link ExecutionOutcome}; it only completes
 * exceptionally for faults outside the provider interaction (for example the store being down).
 */
@Slf4j
class TaskExecutionUnit {

    private final ClaimedTask task;
    private final RemoteJobClient client;
    private final TaskLifecycleService lifecycle;
    private final TaskScheduler timer;
    private final Executor workers;
    private final Duration pollInterval;
    private final Duration maxPollDuration;
    private final Clock clock;

    private final CompletableFuture<ExecutionOutcome> result = new CompletableFuture<>();
    private RemoteJobHandle handle;
    private Instant deadline;
    private String lastProgress;
    private RemoteJobStatus lastStatus;

    TaskExecutionUnit(ClaimedTask task,
                      RemoteJobClient client,
                      TaskLifecycleService lifecycle,
                      TaskScheduler timer,
                      Executor workers,
                      Duration pollInterval,
                      Duration maxPollDuration,
                      Clock clock) {
        this.task = task;
        this.client = client;
        this.lifecycle = lifecycle;
        this.timer = timer;
        this.workers = workers;
        this.pollInterval = pollInterval;
        this.maxPollDuration = maxPollDuration;
        this.clock = clock;
    }

    CompletableFuture<ExecutionOutcome> start() {
        runOnWorker(this::begin);
        return result;
    }

    private void begin() {
        TaskStatus status = lifecycle.currentStatus(task.taskId()).orElse(null);
        if (status == TaskStatus.CANCELLED) {
            log.info("Task {} (owner {}) was cancelled before the provider call", task.taskId(), task.ownerId());
            result.complete(ExecutionOutcome.cancelled());
            return;
        }
        if (status != TaskStatus.RUNNING) {
            log.debug("Task {} (owner {}) left running before execution started: {}", task.taskId(), task.ownerId(), status);
            result.complete(ExecutionOutcome.claimLost());
            return;
        }

        try {
            handle = client.create(new RemoteJobRequest(
                    task.prompt(),
                    task.mediaReference(),
                    task.model(),
                    task.orientation(),
                    task.size(),
                    task.duration(),
                    task.providerIdempotencyKey()));
        } catch (RuntimeException e) {
            log.warn("Task {} (owner {}) remote creation failed: {}", task.taskId(), task.ownerId(), e.getMessage());
            result.complete(ExecutionOutcome.failure(ExecutionErrorKind.PROVIDER_ERROR, describe(e)));
            return;
        }

        deadline = clock.instant().plus(maxPollDuration);
        lifecycle.recordRemoteJob(task.taskId(), handle.jobId());
        log.info("Task {} (owner {}) created remote job {}", task.taskId(), task.ownerId(), handle.jobId());
        poll();
    }

    private void poll() {
        if (!clock.instant().isBefore(deadline)) {
            log.warn("Task {} (owner {}) timed out after {}, last remote status {}", task.taskId(), task.ownerId(),
                    maxPollDuration, lastStatus);
            result.complete(ExecutionOutcome.failure(ExecutionErrorKind.TIMEOUT,
                    "Remote job timed out, last status: " + lastStatus));
            return;
        }

        RemoteJobSnapshot snapshot;
        try {
            snapshot = client.poll(handle);
        } catch (RuntimeException e) {
            log.warn("Task {} (owner {}) polling failed: {}", task.taskId(), task.ownerId(), e.getMessage());
            result.complete(ExecutionOutcome.failure(ExecutionErrorKind.PROVIDER_ERROR, describe(e)));
            return;
        }
        lastStatus = snapshot.status();

        if (snapshot.status() == RemoteJobStatus.COMPLETED && snapshot.hasResult()) {
            result.complete(ExecutionOutcome.success(snapshot.resultLocator()));
            return;
        }
        if (snapshot.status() == RemoteJobStatus.FAILED || snapshot.status() == RemoteJobStatus.CANCELLED) {
            String reason = snapshot.error() != null ? snapshot.error() : "Remote job " + snapshot.status().name().toLowerCase();
            result.complete(ExecutionOutcome.failure(ExecutionErrorKind.PROVIDER_ERROR, reason));
            return;
        }

        String progress = snapshot.progress() != null ? snapshot.progress() : snapshot.status().name().toLowerCase();
        if (!Objects.equals(progress, lastProgress)) {
            recordProgress(progress);
        }
        timer.schedule(() -> runOnWorker(this::poll), clock.instant().plus(pollInterval));
    }

    // a progress write is informational; failing it must not end a healthy remote job
    private void recordProgress(String progress) {
        try {
            lifecycle.recordProgress(task.taskId(), progress);
            lastProgress = progress;
        } catch (RuntimeException e) {
            log.warn("Task {} (owner {}) could not store progress '{}': {}", task.taskId(), task.ownerId(),
                    progress, e.getMessage());
        }
    }

    private void runOnWorker(Runnable step) {
        try {
            workers.execute(() -> {
                try {
                    step.run();
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            });
        } catch (RuntimeException e) {
            result.completeExceptionally(e);
        }
    }

    private static String describe(Throwable e) {
        String message = e.getMessage();
        return message == null || message.isBlank() ? e.getClass().getSimpleName() : message;
    }
}
