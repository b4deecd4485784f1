package uk.gegc.videobatch.features.scheduler.application;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;
import uk.gegc.videobatch.features.scheduler.config.SchedulerProperties;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;

/**
 * Single scheduling loop of this process.
 *
 * <p>The queue holds task ids only and is rebuilt from the store on start. Every tick looks at
 * the head alone. When the head's owner or the whole process is at its concurrency cap the
 * head stays put and nothing behind it is considered (head-of-line blocking).
 *
 * <p>Queue and in-flight counters are guarded by this instance's monitor.
 */
@Slf4j
@Component
public class GenerationScheduler implements SmartLifecycle {

    private final TaskLifecycleService lifecycle;
    private final GenerationJobRunner runner;
    private final SchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final TaskScheduler timer;

    private final LinkedHashSet<UUID> queue = new LinkedHashSet<>();
    private final Map<UUID, Integer> inFlightByOwner = new HashMap<>();
    private int inFlight;

    private volatile ScheduledFuture<?> tickHandle;

    public GenerationScheduler(TaskLifecycleService lifecycle,
                               GenerationJobRunner runner,
                               SchedulerProperties properties,
                               SchedulerMetrics metrics,
                               @Qualifier("generationTimer") TaskScheduler timer) {
        this.lifecycle = lifecycle;
        this.runner = runner;
        this.properties = properties;
        this.metrics = metrics;
        this.timer = timer;
        metrics.bindSchedulerState(this::queueDepth, this::globalInFlight);
    }

    public synchronized void enqueue(UUID taskId) {
        queue.add(taskId);
    }

    public synchronized void enqueueAll(Collection<UUID> taskIds) {
        queue.addAll(taskIds);
    }

    public synchronized List<UUID> queueSnapshot() {
        return new ArrayList<>(queue);
    }

    public synchronized int queueDepth() {
        return queue.size();
    }

    public synchronized int globalInFlight() {
        return inFlight;
    }

    public synchronized int inFlightFor(UUID ownerId) {
        return inFlightByOwner.getOrDefault(ownerId, 0);
    }

    /**
     * Re-enqueue every pending or queued task found in the store.
     */
    public void rebuildQueue() {
        List<UUID> ids = lifecycle.pendingTaskIds();
        enqueueAll(ids);
        log.info("Scheduler queue rebuilt with {} task(s)", ids.size());
    }

    /**
     * Examine the head of the queue once and dispatch it if the caps allow.
     */
    public void tick() {
        ClaimedTask claimed;
        synchronized (this) {
            if (queue.isEmpty()) {
                return;
            }
            UUID head = queue.iterator().next();

            Optional<VideoTask> candidate = lifecycle.findSchedulable(head);
            if (candidate.isEmpty()) {
                queue.remove(head);
                log.debug("Dropping task {} from queue: missing, deleted or not claimable", head);
                return;
            }
            VideoTask task = candidate.get();

            if (inFlight >= properties.getGlobalConcurrency()
                    || inFlightFor(task.getOwnerId()) >= properties.getPerUserConcurrency()) {
                return;
            }

            if (!lifecycle.claim(head, task.getBatchId())) {
                queue.remove(head);
                metrics.recordClaimLost();
                log.debug("Claim conflict on task {}, dropping it", head);
                return;
            }

            queue.remove(head);
            inFlight++;
            inFlightByOwner.merge(task.getOwnerId(), 1, Integer::sum);
            metrics.recordClaimWon();
            claimed = ClaimedTask.from(task);
        }

        log.info("Dispatching task {} (owner {})", claimed.taskId(), claimed.ownerId());
        CompletableFuture<ExecutionOutcome> execution;
        try {
            execution = runner.run(claimed);
        } catch (RuntimeException e) {
            execution = CompletableFuture.failedFuture(e);
        }
        execution.whenComplete((outcome, error) -> onExecutionFinished(claimed, error));
    }

    private void onExecutionFinished(ClaimedTask task, Throwable error) {
        if (error != null) {
            log.error("Execution of task {} (owner {}) ended with an unhandled fault; the reconciler will settle it",
                    task.taskId(), task.ownerId(), error);
        }
        synchronized (this) {
            inFlight--;
            inFlightByOwner.computeIfPresent(task.ownerId(), (owner, count) -> count > 1 ? count - 1 : null);
        }
    }

    private void safeTick() {
        try {
            tick();
        } catch (Exception e) {
            log.error("Scheduler tick failed", e);
        }
    }

    @Override
    public void start() {
        if (tickHandle != null) {
            return;
        }
        rebuildQueue();
        tickHandle = timer.scheduleWithFixedDelay(this::safeTick, properties.getTickInterval());
        log.info("Generation scheduler started - global cap: {}, per-owner cap: {}, tick: {}",
                properties.getGlobalConcurrency(), properties.getPerUserConcurrency(), properties.getTickInterval());
    }

    @Override
    public void stop() {
        ScheduledFuture<?> handle = tickHandle;
        if (handle != null) {
            handle.cancel(false);
            tickHandle = null;
            log.info("Generation scheduler stopped with {} task(s) queued and {} in flight", queueDepth(), globalInFlight());
        }
    }

    @Override
    public boolean isRunning() {
        return tickHandle != null;
    }

    @Override
    public boolean isAutoStartup() {
        return properties.isEnabled();
    }
}
