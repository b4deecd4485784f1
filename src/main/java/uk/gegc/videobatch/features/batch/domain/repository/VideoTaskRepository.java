package uk.gegc.videobatch.features.batch.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Every status change is a conditional single-statement UPDATE. The returned row count tells
 * the caller whether it won the transition; 0 means another actor moved the task first.
 */
@Repository
public interface VideoTaskRepository extends JpaRepository<VideoTask, UUID> {

    Optional<VideoTask> findByIdAndDeletedAtIsNull(UUID id);

    Optional<VideoTask> findByIdAndOwnerIdAndDeletedAtIsNull(UUID id, UUID ownerId);

    List<VideoTask> findByBatchIdAndDeletedAtIsNullOrderByCreatedAtAsc(UUID batchId);

    /**
     * Ids that belong in the volatile queue after a restart, oldest first.
     */
    @Query("""
        SELECT t.id FROM VideoTask t
        WHERE t.status IN :statuses AND t.deletedAt IS NULL
        ORDER BY t.createdAt ASC, t.id ASC
    """)
    List<UUID> findIdsByStatusInOrderByCreatedAt(@Param("statuses") Collection<TaskStatus> statuses);

    /**
     * Status histogram of the non-deleted tasks of one batch.
     */
    @Query("""
        SELECT t.status AS status, COUNT(t) AS total FROM VideoTask t
        WHERE t.batchId = :batchId AND t.deletedAt IS NULL
        GROUP BY t.status
    """)
    List<StatusCount> countByStatus(@Param("batchId") UUID batchId);

    @Query("""
        SELECT DISTINCT t.batchId FROM VideoTask t
        WHERE t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
          AND t.updatedAt < :cutoff AND t.deletedAt IS NULL
    """)
    List<UUID> findBatchIdsWithStaleRunning(@Param("cutoff") LocalDateTime cutoff);

    @Query("""
        SELECT DISTINCT t.batchId FROM VideoTask t
        WHERE t.resultLocator IS NOT NULL
          AND t.status NOT IN (uk.gegc.videobatch.features.batch.domain.model.TaskStatus.COMPLETED,
                               uk.gegc.videobatch.features.batch.domain.model.TaskStatus.CANCELLED)
          AND t.deletedAt IS NULL
    """)
    List<UUID> findBatchIdsWithUnflaggedResults();

    @Query("SELECT t.status FROM VideoTask t WHERE t.id = :id")
    Optional<TaskStatus> findStatusById(@Param("id") UUID id);

    /**
     * The claim: {@code pending | queued -> running}.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING,
            t.updatedAt = :now
        WHERE t.id = :id
          AND t.status IN (uk.gegc.videobatch.features.batch.domain.model.TaskStatus.PENDING,
                           uk.gegc.videobatch.features.batch.domain.model.TaskStatus.QUEUED)
          AND t.deletedAt IS NULL
    """)
    int claim(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.remoteJobId = :remoteJobId, t.remoteStartedAt = :now, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
    """)
    int recordRemoteJob(@Param("id") UUID id, @Param("remoteJobId") String remoteJobId,
                        @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.progress = :progress, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
    """)
    int recordProgress(@Param("id") UUID id, @Param("progress") String progress,
                       @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.COMPLETED,
            t.resultLocator = :locator, t.errorSummary = NULL, t.remoteFinishedAt = :now, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
    """)
    int completeRunning(@Param("id") UUID id, @Param("locator") String locator, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.FAILED,
            t.errorSummary = :error, t.remoteFinishedAt = :now, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
    """)
    int failRunning(@Param("id") UUID id, @Param("error") String error, @Param("now") LocalDateTime now);

    /**
     * Staleness variant of {@link #failRunning}: only wins if the task has not been touched since the cutoff.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.FAILED,
            t.errorSummary = :error, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING
          AND t.updatedAt < :cutoff AND t.deletedAt IS NULL
    """)
    int failStaleRunning(@Param("id") UUID id, @Param("error") String error,
                         @Param("cutoff") LocalDateTime cutoff, @Param("now") LocalDateTime now);

    /**
     * Heals a task whose result was recorded but whose status write was lost.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.COMPLETED,
            t.updatedAt = :now
        WHERE t.id = :id AND t.resultLocator IS NOT NULL
          AND t.status NOT IN (uk.gegc.videobatch.features.batch.domain.model.TaskStatus.COMPLETED,
                               uk.gegc.videobatch.features.batch.domain.model.TaskStatus.CANCELLED)
          AND t.deletedAt IS NULL
    """)
    int markResultCompleted(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.QUEUED,
            t.errorSummary = NULL, t.resultLocator = NULL, t.progress = NULL, t.remoteJobId = NULL,
            t.remoteStartedAt = NULL, t.remoteFinishedAt = NULL,
            t.retries = t.retries + 1, t.updatedAt = :now
        WHERE t.id = :id AND t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.FAILED
          AND t.deletedAt IS NULL
    """)
    int requeueFailed(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.CANCELLED,
            t.updatedAt = :now
        WHERE t.id = :id
          AND t.status IN (uk.gegc.videobatch.features.batch.domain.model.TaskStatus.PENDING,
                           uk.gegc.videobatch.features.batch.domain.model.TaskStatus.QUEUED,
                           uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING)
          AND t.deletedAt IS NULL
    """)
    int cancelActive(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE VideoTask t SET t.status = uk.gegc.videobatch.features.batch.domain.model.TaskStatus.CANCELLED,
            t.updatedAt = :now
        WHERE t.batchId = :batchId
          AND t.status IN (uk.gegc.videobatch.features.batch.domain.model.TaskStatus.PENDING,
                           uk.gegc.videobatch.features.batch.domain.model.TaskStatus.QUEUED,
                           uk.gegc.videobatch.features.batch.domain.model.TaskStatus.RUNNING)
          AND t.deletedAt IS NULL
    """)
    int cancelActiveInBatch(@Param("batchId") UUID batchId, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoTask t SET t.deletedAt = :now, t.updatedAt = :now WHERE t.id = :id AND t.deletedAt IS NULL")
    int softDelete(@Param("id") UUID id, @Param("now") LocalDateTime now);

    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE VideoTask t SET t.deletedAt = :now, t.updatedAt = :now WHERE t.batchId = :batchId AND t.deletedAt IS NULL")
    int softDeleteByBatchId(@Param("batchId") UUID batchId, @Param("now") LocalDateTime now);

    interface StatusCount {
        TaskStatus getStatus();

        long getTotal();
    }
}
