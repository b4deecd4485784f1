package uk.gegc.videobatch.features.batch.application;

import uk.gegc.videobatch.features.batch.api.dto.TaskDto;

import java.util.UUID;

/**
 * Owner initiated task and batch commands.
 *
 * @throws uk.gegc.videobatch.shared.exception.ResourceNotFoundException for unknown, deleted or foreign ids
 */
public interface TaskCommandService {

    /**
     * {@code failed -> queued}. Clears the error and result, bumps the retry counter and
     * re-enqueues the task once committed.
     */
    TaskDto retry(UUID ownerId, UUID taskId);

    /**
     * {@code pending | queued | running -> cancelled}. A running provider job is not aborted.
     */
    TaskDto cancel(UUID ownerId, UUID taskId);

    void deleteTask(UUID ownerId, UUID taskId);

    /**
     * Soft-deletes the batch and its tasks. Tasks that were still active are cancelled first.
     */
    void deleteBatch(UUID ownerId, UUID batchId);
}
