package uk.gegc.videobatch.features.batch.domain.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a generation task.
 *
 * <pre>
 * PENDING -> QUEUED -> RUNNING -> COMPLETED | FAILED | CANCELLED
 * FAILED  -> QUEUED                       (explicit retry)
 * PENDING | QUEUED | RUNNING -> CANCELLED (cancel or parent deletion)
 * </pre>
 */
public enum TaskStatus {
    PENDING,
    QUEUED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public static final Set<TaskStatus> CLAIMABLE = EnumSet.of(PENDING, QUEUED);

    public boolean canTransitionTo(TaskStatus target) {
        if (target == null) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == QUEUED || target == RUNNING || target == CANCELLED;
            case QUEUED -> target == RUNNING || target == CANCELLED;
            case RUNNING -> target == COMPLETED || target == FAILED || target == CANCELLED;
            case FAILED -> target == QUEUED;
            case COMPLETED, CANCELLED -> false;
        };
    }

    public boolean isClaimable() {
        return CLAIMABLE.contains(this);
    }

    public String value() {
        return name().toLowerCase();
    }
}
