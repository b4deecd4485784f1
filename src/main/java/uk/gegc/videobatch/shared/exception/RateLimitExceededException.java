package uk.gegc.videobatch.shared.exception;

public class RateLimitExceededException extends RuntimeException {
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, long retryAfterSeconds) {
        super(message);
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public RateLimitExceededException(String message) {
        this(message, 60);
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
