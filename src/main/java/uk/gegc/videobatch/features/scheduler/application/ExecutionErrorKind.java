package uk.gegc.videobatch.features.scheduler.application;

public enum ExecutionErrorKind {
    /** Creation or polling threw, or the provider reported failed/cancelled. */
    PROVIDER_ERROR,
    /** The job did not finish before the maximum poll duration. */
    TIMEOUT,
    /** The task was no longer running when the unit tried to act on it. */
    CLAIM_LOST,
    /** The task was cancelled before the provider was called. */
    CANCELLED;

    /**
     * Failures that end in {@code failed} and give the owner their credits back.
     */
    public boolean isRefundable() {
        return this == PROVIDER_ERROR || this == TIMEOUT;
    }
}
