package uk.gegc.videobatch.features.batch.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.videobatch.features.batch.api.dto.TaskDto;
import uk.gegc.videobatch.features.batch.application.BatchAggregateService;
import uk.gegc.videobatch.features.batch.application.TaskCommandService;
import uk.gegc.videobatch.features.batch.domain.events.TasksReadyEvent;
import uk.gegc.videobatch.features.batch.domain.exception.IllegalTaskTransitionException;
import uk.gegc.videobatch.features.batch.domain.model.Batch;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;
import uk.gegc.videobatch.features.batch.domain.repository.BatchRepository;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;
import uk.gegc.videobatch.features.batch.infra.mapping.TaskMapper;
import uk.gegc.videobatch.shared.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class TaskCommandServiceImpl implements TaskCommandService {

    private final VideoTaskRepository taskRepository;
    private final BatchRepository batchRepository;
    private final BatchAggregateService aggregateService;
    private final TaskMapper taskMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;

    @Override
    @Transactional
    public TaskDto retry(UUID ownerId, UUID taskId) {
        VideoTask task = loadOwned(ownerId, taskId);
        if (task.getStatus() != TaskStatus.FAILED) {
            throw new IllegalTaskTransitionException(taskId, task.getStatus(), TaskStatus.QUEUED);
        }
        if (taskRepository.requeueFailed(taskId, LocalDateTime.now(clock)) == 0) {
            throw new IllegalTaskTransitionException(taskId, currentStatus(taskId), TaskStatus.QUEUED);
        }
        aggregateService.recompute(task.getBatchId());
        eventPublisher.publishEvent(new TasksReadyEvent(this, task.getBatchId(), List.of(taskId)));
        log.info("Task {} of owner {} re-queued for retry", taskId, ownerId);
        return reload(taskId);
    }

    @Override
    @Transactional
    public TaskDto cancel(UUID ownerId, UUID taskId) {
        VideoTask task = loadOwned(ownerId, taskId);
        if (!task.getStatus().canTransitionTo(TaskStatus.CANCELLED)) {
            throw new IllegalTaskTransitionException(taskId, task.getStatus(), TaskStatus.CANCELLED);
        }
        if (taskRepository.cancelActive(taskId, LocalDateTime.now(clock)) == 0) {
            throw new IllegalTaskTransitionException(taskId, currentStatus(taskId), TaskStatus.CANCELLED);
        }
        aggregateService.recompute(task.getBatchId());
        log.info("Task {} of owner {} cancelled (was {})", taskId, ownerId, task.getStatus());
        return reload(taskId);
    }

    @Override
    @Transactional
    public void deleteTask(UUID ownerId, UUID taskId) {
        VideoTask task = loadOwned(ownerId, taskId);
        taskRepository.softDelete(taskId, LocalDateTime.now(clock));
        aggregateService.recompute(task.getBatchId());
        log.info("Task {} of owner {} deleted", taskId, ownerId);
    }

    @Override
    @Transactional
    public void deleteBatch(UUID ownerId, UUID batchId) {
        Batch batch = batchRepository.findByIdAndOwnerIdAndDeletedAtIsNull(batchId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch " + batchId + " not found"));
        LocalDateTime now = LocalDateTime.now(clock);
        int cancelled = taskRepository.cancelActiveInBatch(batchId, now);
        int deleted = taskRepository.softDeleteByBatchId(batchId, now);

        batch = batchRepository.findById(batchId).orElseThrow();
        batch.setDeletedAt(now);
        batchRepository.save(batch);
        aggregateService.recompute(batchId);
        log.info("Batch {} of owner {} deleted ({} tasks, {} cancelled)", batchId, ownerId, deleted, cancelled);
    }

    private VideoTask loadOwned(UUID ownerId, UUID taskId) {
        return taskRepository.findByIdAndOwnerIdAndDeletedAtIsNull(taskId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Task " + taskId + " not found"));
    }

    private TaskStatus currentStatus(UUID taskId) {
        return taskRepository.findStatusById(taskId).orElse(null);
    }

    private TaskDto reload(UUID taskId) {
        return taskRepository.findById(taskId)
                .map(taskMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("Task " + taskId + " not found"));
    }
}
