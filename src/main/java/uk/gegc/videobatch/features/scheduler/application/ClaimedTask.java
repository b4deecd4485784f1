package uk.gegc.videobatch.features.scheduler.application;

import uk.gegc.videobatch.features.batch.domain.model.VideoTask;

import java.util.UUID;

/**
 * Immutable copy of a task taken at claim time; execution units never touch the entity.
 */
public record ClaimedTask(
        UUID taskId,
        UUID batchId,
        UUID ownerId,
        String prompt,
        String mediaReference,
        String model,
        String orientation,
        String size,
        int duration,
        int unitCost,
        int retries
) {
    public static ClaimedTask from(VideoTask task) {
        return new ClaimedTask(
                task.getId(),
                task.getBatchId(),
                task.getOwnerId(),
                task.getPrompt(),
                task.getMediaReference(),
                task.getModel(),
                task.getOrientation(),
                task.getSize(),
                task.getDuration(),
                task.getUnitCost(),
                task.getRetries());
    }

    /**
     * Stable per attempt, so a duplicated create for the same attempt is collapsed by the provider.
     */
    public String providerIdempotencyKey() {
        return "task-" + taskId + "-" + retries;
    }
}
