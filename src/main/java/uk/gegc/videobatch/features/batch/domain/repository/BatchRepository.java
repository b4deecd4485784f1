package uk.gegc.videobatch.features.batch.domain.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.videobatch.features.batch.domain.model.Batch;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BatchRepository extends JpaRepository<Batch, UUID> {

    Optional<Batch> findByIdAndDeletedAtIsNull(UUID id);

    Optional<Batch> findByIdAndOwnerIdAndDeletedAtIsNull(UUID id, UUID ownerId);

    Page<Batch> findByOwnerIdAndDeletedAtIsNullOrderByCreatedAtDesc(UUID ownerId, Pageable pageable);
}
