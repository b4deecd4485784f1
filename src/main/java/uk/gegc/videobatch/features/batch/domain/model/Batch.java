package uk.gegc.videobatch.features.batch.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

/**
 * A single submission of N generation units sharing one configuration.
 *
 * <p>The counters are derived data. They are only written by {@link #applyStatusCounts(Map, LocalDateTime)},
 * which receives a fresh count of the batch's non-deleted tasks.
 */
@Entity
@Table(name = "batches", indexes = {
        @Index(name = "idx_batches_owner_created", columnList = "owner_id, created_at")
})
@Getter
@Setter
public class Batch {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "prompt", nullable = false, columnDefinition = "TEXT")
    private String prompt;

    @Column(name = "model", nullable = false, length = 32)
    private String model;

    @Column(name = "orientation", nullable = false, length = 16)
    private String orientation;

    @Column(name = "size", nullable = false, length = 16)
    private String size;

    @Column(name = "duration", nullable = false)
    private int duration;

    @Column(name = "requested_count", nullable = false)
    private int requestedCount;

    @Column(name = "media_reference", columnDefinition = "TEXT")
    private String mediaReference;

    @Column(name = "unit_cost", nullable = false)
    private int unitCost;

    @Column(name = "total", nullable = false)
    private int total;

    @Column(name = "completed", nullable = false)
    private int completed;

    @Column(name = "failed", nullable = false)
    private int failed;

    @Column(name = "running", nullable = false)
    private int running;

    @Column(name = "queued", nullable = false)
    private int queued;

    @Column(name = "cancelled", nullable = false)
    private int cancelled;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;

    /**
     * Overwrite every counter from a status histogram of the non-deleted tasks.
     * Pending tasks are reported as queued.
     */
    public void applyStatusCounts(Map<TaskStatus, Long> counts, LocalDateTime now) {
        this.completed = count(counts, TaskStatus.COMPLETED);
        this.failed = count(counts, TaskStatus.FAILED);
        this.running = count(counts, TaskStatus.RUNNING);
        this.queued = count(counts, TaskStatus.QUEUED) + count(counts, TaskStatus.PENDING);
        this.cancelled = count(counts, TaskStatus.CANCELLED);
        this.total = completed + failed + running + queued + cancelled;
        this.updatedAt = now;
    }

    private static int count(Map<TaskStatus, Long> counts, TaskStatus status) {
        Long value = counts.get(status);
        return value == null ? 0 : value.intValue();
    }
}
