package uk.gegc.videobatch.features.batch.domain.exception;

/**
 * A submission was rejected before any state was touched.
 */
public class SubmissionValidationException extends RuntimeException {

    private final String field;

    public SubmissionValidationException(String field, String message) {
        super(message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
