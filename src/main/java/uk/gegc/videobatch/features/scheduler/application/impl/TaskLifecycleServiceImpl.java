package uk.gegc.videobatch.features.scheduler.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.videobatch.features.batch.application.BatchAggregateService;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;
import uk.gegc.videobatch.features.ledger.application.CreditLedgerService;
import uk.gegc.videobatch.features.scheduler.application.ClaimedTask;
import uk.gegc.videobatch.features.scheduler.application.ExecutionOutcome;
import uk.gegc.videobatch.features.scheduler.application.SchedulerMetrics;
import uk.gegc.videobatch.features.scheduler.application.TaskLifecycleService;
import uk.gegc.videobatch.features.scheduler.config.SchedulerProperties;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskLifecycleServiceImpl implements TaskLifecycleService {

    // width of video_tasks.progress
    static final int PROGRESS_MAX_LENGTH = 16;

    private final VideoTaskRepository taskRepository;
    private final CreditLedgerService ledgerService;
    private final BatchAggregateService aggregateService;
    private final SchedulerProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<VideoTask> findSchedulable(UUID taskId) {
        return taskRepository.findByIdAndDeletedAtIsNull(taskId)
                .filter(task -> task.getStatus().isClaimable());
    }

    @Override
    @Transactional
    public boolean claim(UUID taskId, UUID batchId) {
        if (taskRepository.claim(taskId, now()) == 0) {
            return false;
        }
        aggregateService.recompute(batchId);
        return true;
    }

    @Override
    @Transactional(readOnly = true)
    public List<UUID> pendingTaskIds() {
        return taskRepository.findIdsByStatusInOrderByCreatedAt(TaskStatus.CLAIMABLE);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<TaskStatus> currentStatus(UUID taskId) {
        return taskRepository.findStatusById(taskId);
    }

    @Override
    @Transactional
    public void recordRemoteJob(UUID taskId, String remoteJobId) {
        taskRepository.recordRemoteJob(taskId, remoteJobId, now());
    }

    @Override
    @Transactional
    public void recordProgress(UUID taskId, String progress) {
        taskRepository.recordProgress(taskId, abbreviate(progress, PROGRESS_MAX_LENGTH), now());
    }

    @Override
    @Transactional
    public void finish(ClaimedTask task, ExecutionOutcome outcome) {
        if (outcome.isSuccess()) {
            int updated = taskRepository.completeRunning(task.taskId(), outcome.resultLocator(), now());
            if (updated == 0) {
                metrics.recordResultDropped();
                log.info("Dropping result of task {} (owner {}): task is no longer running", task.taskId(), task.ownerId());
            } else {
                log.info("Task {} (owner {}) completed", task.taskId(), task.ownerId());
            }
        } else if (outcome.errorKind().isRefundable()) {
            String summary = truncate(outcome.errorSummary());
            int updated = taskRepository.failRunning(task.taskId(), summary, now());
            if (updated == 1) {
                log.warn("Task {} (owner {}) failed with {}: {}", task.taskId(), task.ownerId(),
                        outcome.errorKind(), summary);
            }
            refundIfFailed(task.taskId(), task.ownerId(), task.batchId(), task.unitCost());
        } else {
            log.debug("Task {} (owner {}) ended without execution: {}", task.taskId(), task.ownerId(),
                    outcome.errorKind());
        }
        aggregateService.recompute(task.batchId());
    }

    @Override
    @Transactional
    public boolean healCompleted(UUID taskId) {
        return taskRepository.markResultCompleted(taskId, now()) == 1;
    }

    @Override
    @Transactional
    public boolean expireStale(UUID taskId, LocalDateTime cutoff, String reason) {
        Optional<VideoTask> task = taskRepository.findByIdAndDeletedAtIsNull(taskId);
        if (task.isEmpty()) {
            return false;
        }
        if (taskRepository.failStaleRunning(taskId, truncate(reason), cutoff, now()) == 0) {
            return false;
        }
        VideoTask expired = task.get();
        refundIfFailed(taskId, expired.getOwnerId(), expired.getBatchId(), expired.getUnitCost());
        return true;
    }

    private void refundIfFailed(UUID taskId, UUID ownerId, UUID batchId, int unitCost) {
        TaskStatus status = taskRepository.findStatusById(taskId).orElse(null);
        if (status != TaskStatus.FAILED) {
            return;
        }
        if (ledgerService.refundTask(ownerId, batchId, taskId, unitCost)) {
            metrics.recordRefund();
        }
    }

    private String truncate(String summary) {
        String value = summary == null || summary.isBlank() ? "Unknown error" : summary;
        return abbreviate(value, properties.getErrorSummaryMaxLength());
    }

    private static String abbreviate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }

    private LocalDateTime now() {
        return LocalDateTime.now(clock);
    }
}
