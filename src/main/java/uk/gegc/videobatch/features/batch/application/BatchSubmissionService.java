package uk.gegc.videobatch.features.batch.application;

import uk.gegc.videobatch.features.batch.api.dto.BatchSubmissionRequest;
import uk.gegc.videobatch.features.batch.api.dto.BatchSubmissionResult;

import java.util.UUID;

public interface BatchSubmissionService {

    /**
     * Admit a batch: validate, replay a known idempotency key, apply the rate limit, check funds,
     * then persist the batch, its debit and its tasks in one transaction. Tasks are handed to the
     * scheduler after the commit.
     *
     * @param idempotencyKey optional client key; {@code null} or blank disables replay
     * @throws uk.gegc.videobatch.features.batch.domain.exception.SubmissionValidationException       on bad input
     * @throws uk.gegc.videobatch.features.batch.domain.exception.DuplicateSubmissionException        key replayed but its batch is gone
     * @throws uk.gegc.videobatch.shared.exception.RateLimitExceededException                          too many recent submissions
     * @throws uk.gegc.videobatch.features.ledger.domain.exception.InsufficientCreditsException        balance below the total cost
     */
    BatchSubmissionResult submit(UUID ownerId, BatchSubmissionRequest request, String idempotencyKey);
}
