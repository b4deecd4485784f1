package uk.gegc.videobatch.features.scheduler.application;

/**
 * Result of one execution attempt. Failures are values, not exceptions.
 *
 * @param resultLocator set on success only
 * @param errorKind     {@code null} on success
 * @param errorSummary  human readable reason, untruncated
 */
public record ExecutionOutcome(
        String resultLocator,
        ExecutionErrorKind errorKind,
        String errorSummary
) {
    public static ExecutionOutcome success(String resultLocator) {
        return new ExecutionOutcome(resultLocator, null, null);
    }

    public static ExecutionOutcome failure(ExecutionErrorKind kind, String errorSummary) {
        return new ExecutionOutcome(null, kind, errorSummary);
    }

    public static ExecutionOutcome cancelled() {
        return failure(ExecutionErrorKind.CANCELLED, "Cancelled before the provider was called");
    }

    public static ExecutionOutcome claimLost() {
        return failure(ExecutionErrorKind.CLAIM_LOST, "Task is no longer running");
    }

    public boolean isSuccess() {
        return errorKind == null;
    }
}
