package uk.gegc.videobatch.features.reconciliation.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.videobatch.features.batch.application.BatchAggregateService;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;
import uk.gegc.videobatch.features.reconciliation.application.BatchReconciler;
import uk.gegc.videobatch.features.reconciliation.config.ReconcilerProperties;
import uk.gegc.videobatch.features.scheduler.application.SchedulerMetrics;
import uk.gegc.videobatch.features.scheduler.application.TaskLifecycleService;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;

@Slf4j
@Service
@RequiredArgsConstructor
public class BatchReconcilerImpl implements BatchReconciler {

    private final VideoTaskRepository taskRepository;
    private final TaskLifecycleService lifecycle;
    private final BatchAggregateService aggregateService;
    private final ReconcilerProperties properties;
    private final SchedulerMetrics metrics;
    private final Clock clock;

    @Override
    public ReconciliationReport reconcileBatch(UUID batchId) {
        List<VideoTask> tasks;
        try {
            tasks = taskRepository.findByBatchIdAndDeletedAtIsNullOrderByCreatedAtAsc(batchId);
        } catch (Exception e) {
            log.error("Could not load tasks of batch {} for reconciliation", batchId, e);
            return new ReconciliationReport(batchId, 0, 0, 1);
        }

        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getStaleRunningThreshold());
        int healed = 0;
        int expired = 0;
        int errors = 0;

        for (VideoTask task : tasks) {
            try {
                if (task.getResultLocator() != null
                        && task.getStatus() != TaskStatus.COMPLETED
                        && task.getStatus() != TaskStatus.CANCELLED) {
                    if (lifecycle.healCompleted(task.getId())) {
                        healed++;
                        metrics.recordReconcilerCorrection("healed_completed");
                        log.info("Reconciler marked task {} of batch {} completed (had a result in {})",
                                task.getId(), batchId, task.getStatus());
                    }
                } else if (task.getStatus() == TaskStatus.RUNNING && task.getUpdatedAt().isBefore(cutoff)) {
                    if (lifecycle.expireStale(task.getId(), cutoff, properties.getStaleReason())) {
                        expired++;
                        metrics.recordReconcilerCorrection("expired_running");
                        log.warn("Reconciler failed stale running task {} of batch {} (last update {})",
                                task.getId(), batchId, task.getUpdatedAt());
                    }
                }
            } catch (Exception e) {
                errors++;
                log.error("Reconciler could not correct task {} of batch {}: {}", task.getId(), batchId,
                        e.getMessage(), e);
            }
        }

        try {
            aggregateService.recompute(batchId);
        } catch (Exception e) {
            errors++;
            log.error("Reconciler could not recompute aggregates of batch {}", batchId, e);
        }
        return new ReconciliationReport(batchId, healed, expired, errors);
    }

    @Override
    public SweepSummary sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(properties.getStaleRunningThreshold());
        Set<UUID> batchIds = new LinkedHashSet<>();
        batchIds.addAll(taskRepository.findBatchIdsWithStaleRunning(cutoff));
        batchIds.addAll(taskRepository.findBatchIdsWithUnflaggedResults());

        int healed = 0;
        int expired = 0;
        int errors = 0;
        for (UUID batchId : batchIds) {
            ReconciliationReport report = reconcileBatch(batchId);
            healed += report.healedCompleted();
            expired += report.expiredRunning();
            errors += report.errors();
        }

        SweepSummary summary = new SweepSummary(batchIds.size(), healed, expired, errors);
        if (!batchIds.isEmpty()) {
            log.info("Reconciliation sweep: {} batch(es), {} healed, {} expired, {} error(s)",
                    summary.batchesVisited(), healed, expired, errors);
        }
        return summary;
    }
}
