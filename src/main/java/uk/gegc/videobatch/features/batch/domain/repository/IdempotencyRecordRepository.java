package uk.gegc.videobatch.features.batch.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.videobatch.features.batch.domain.model.IdempotencyRecord;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface IdempotencyRecordRepository extends JpaRepository<IdempotencyRecord, UUID> {

    Optional<IdempotencyRecord> findByOwnerIdAndIdempotencyKey(UUID ownerId, String idempotencyKey);
}
