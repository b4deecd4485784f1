package uk.gegc.videobatch.features.batch.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One generation unit of a batch. Status changes go through the conditional updates of
 * {@code VideoTaskRepository}; the entity is loaded for reads.
 */
@Entity
@Table(name = "video_tasks", indexes = {
        @Index(name = "idx_video_tasks_batch", columnList = "batch_id"),
        @Index(name = "idx_video_tasks_status_updated", columnList = "status, updated_at")
})
@Getter
@Setter
public class VideoTask {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "batch_id", nullable = false, updatable = false)
    private UUID batchId;

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

    @Column(name = "media_reference", columnDefinition = "TEXT")
    private String mediaReference;

    /**
     * Credits charged for this unit at admission; the amount a refund gives back.
     */
    @Column(name = "unit_cost", nullable = false)
    private int unitCost;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TaskStatus status;

    @Column(name = "error_summary", length = 500)
    private String errorSummary;

    @Column(name = "result_locator", columnDefinition = "TEXT")
    private String resultLocator;

    @Column(name = "progress", length = 16)
    private String progress;

    @Column(name = "remote_job_id", length = 128)
    private String remoteJobId;

    @Column(name = "remote_started_at")
    private LocalDateTime remoteStartedAt;

    @Column(name = "remote_finished_at")
    private LocalDateTime remoteFinishedAt;

    @Column(name = "retries", nullable = false)
    private int retries;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Column(name = "deleted_at")
    private LocalDateTime deletedAt;
}
