package uk.gegc.videobatch.features.batch.domain.events;

import lombok.Getter;
import org.springframework.context.ApplicationEvent;

import java.util.List;
import java.util.UUID;

/**
 * Published inside the transaction that made tasks claimable (admission or retry).
 * Listeners see it only once that transaction has committed.
 */
@Getter
public class TasksReadyEvent extends ApplicationEvent {

    private final UUID batchId;
    private final List<UUID> taskIds;

    public TasksReadyEvent(Object source, UUID batchId, List<UUID> taskIds) {
        super(source);
        this.batchId = batchId;
        this.taskIds = List.copyOf(taskIds);
    }
}
