package uk.gegc.videobatch.features.ledger.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import uk.gegc.videobatch.features.ledger.domain.model.CreditTransaction;

import java.util.UUID;

public interface CreditTransactionRepository extends JpaRepository<CreditTransaction, UUID> {

    @Query("select coalesce(sum(t.delta), 0) from CreditTransaction t where t.ownerId = :ownerId")
    long sumDeltaByOwnerId(@Param("ownerId") UUID ownerId);

    /**
     * Refund dedup probe: any positive entry already referencing the task.
     */
    boolean existsByRefTaskIdAndDeltaGreaterThan(UUID refTaskId, int delta);

    Page<CreditTransaction> findByOwnerIdOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);
}
