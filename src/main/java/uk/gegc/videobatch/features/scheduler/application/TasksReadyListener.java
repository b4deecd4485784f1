package uk.gegc.videobatch.features.scheduler.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.videobatch.features.batch.domain.events.TasksReadyEvent;

/**
 * Hands committed tasks to the scheduler. Running after commit keeps the scheduler from
 * seeing ids whose rows are not visible yet.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TasksReadyListener {

    private final GenerationScheduler scheduler;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onTasksReady(TasksReadyEvent event) {
        scheduler.enqueueAll(event.getTaskIds());
        log.debug("Enqueued {} task(s) of batch {}", event.getTaskIds().size(), event.getBatchId());
    }
}
