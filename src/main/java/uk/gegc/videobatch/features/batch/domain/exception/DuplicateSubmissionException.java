package uk.gegc.videobatch.features.batch.domain.exception;

/**
 * Thrown when an idempotency key is still inside its replay window but the batch it
 * pointed to no longer exists, so there is nothing to replay.
 */
public class DuplicateSubmissionException extends RuntimeException {

    private final String idempotencyKey;

    public DuplicateSubmissionException(String idempotencyKey) {
        super(String.format("Duplicate submission for idempotency key %s", idempotencyKey));
        this.idempotencyKey = idempotencyKey;
    }

    public String getIdempotencyKey() {
        return idempotencyKey;
    }
}
