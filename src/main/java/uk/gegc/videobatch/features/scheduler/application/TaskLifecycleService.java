package uk.gegc.videobatch.features.scheduler.application;

import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Store side of task execution. Each method runs in its own transaction and every status change
 * is a conditional update, so concurrent actors (scheduler, execution units, reconciler, owner
 * commands) never overwrite each other.
 */
public interface TaskLifecycleService {

    /**
     * The task if it exists, is not deleted and is still pending or queued.
     */
    Optional<VideoTask> findSchedulable(UUID taskId);

    /**
     * Atomic {@code pending | queued -> running}; the batch is recounted when the claim wins.
     *
     * @return {@code false} when another actor got there first
     */
    boolean claim(UUID taskId, UUID batchId);

    /**
     * Ids of all non-deleted pending or queued tasks, oldest first.
     */
    List<UUID> pendingTaskIds();

    /**
     * Stored status of the task, empty when the row does not exist.
     */
    Optional<TaskStatus> currentStatus(UUID taskId);

    void recordRemoteJob(UUID taskId, String remoteJobId);

    /**
     * Stores the latest provider progress, cut to the column width.
     */
    void recordProgress(UUID taskId, String progress);

    /**
     * Persist the outcome of an execution attempt: completion, failure with refund, or nothing
     * for cancelled and lost claims. Batch counters are recomputed in every case.
     */
    void finish(ClaimedTask task, ExecutionOutcome outcome);

    /**
     * Force a task that carries a result but was never marked completed to {@code completed}.
     */
    boolean healCompleted(UUID taskId);

    /**
     * Fail a task that has been running without any update since {@code cutoff}, then refund it.
     */
    boolean expireStale(UUID taskId, LocalDateTime cutoff, String reason);
}
