package uk.gegc.videobatch.features.batch.domain.exception;

import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;

import java.util.UUID;

public class IllegalTaskTransitionException extends RuntimeException {

    private final UUID taskId;
    private final TaskStatus currentStatus;
    private final TaskStatus targetStatus;

    public IllegalTaskTransitionException(UUID taskId, TaskStatus currentStatus, TaskStatus targetStatus) {
        super(String.format("Task %s cannot move from %s to %s", taskId, currentStatus, targetStatus));
        this.taskId = taskId;
        this.currentStatus = currentStatus;
        this.targetStatus = targetStatus;
    }

    public UUID getTaskId() {
        return taskId;
    }

    public TaskStatus getCurrentStatus() {
        return currentStatus;
    }

    public TaskStatus getTargetStatus() {
        return targetStatus;
    }
}
