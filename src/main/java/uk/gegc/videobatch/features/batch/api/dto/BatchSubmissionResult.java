package uk.gegc.videobatch.features.batch.api.dto;

import java.util.UUID;

/**
 * @param replayed true when an idempotency key matched a prior submission and nothing was written
 */
public record BatchSubmissionResult(
        UUID batchId,
        boolean replayed,
        long totalCost
) {
    public static BatchSubmissionResult created(UUID batchId, long totalCost) {
        return new BatchSubmissionResult(batchId, false, totalCost);
    }

    public static BatchSubmissionResult replay(UUID batchId) {
        return new BatchSubmissionResult(batchId, true, 0L);
    }
}
