package uk.gegc.videobatch.features.ledger.domain.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One signed entry of the append-only credit ledger. Rows are inserted and never
 * updated or deleted; an owner's balance is the sum of their deltas.
 */
@Entity
@Table(name = "credit_transactions", indexes = {
        @Index(name = "idx_credit_tx_owner", columnList = "owner_id"),
        @Index(name = "idx_credit_tx_ref_task", columnList = "ref_task_id"),
        @Index(name = "idx_credit_tx_ref_batch", columnList = "ref_batch_id")
})
@Getter
@Setter
public class CreditTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", nullable = false, updatable = false)
    private UUID id;

    @Column(name = "owner_id", nullable = false, updatable = false)
    private UUID ownerId;

    @Column(name = "delta", nullable = false, updatable = false)
    private int delta;

    @Column(name = "reason", nullable = false, updatable = false, length = 64)
    private String reason;

    @Column(name = "ref_batch_id", updatable = false)
    private UUID refBatchId;

    @Column(name = "ref_task_id", updatable = false)
    private UUID refTaskId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    void prePersist() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }
}
