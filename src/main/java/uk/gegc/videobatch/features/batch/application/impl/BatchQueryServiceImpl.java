package uk.gegc.videobatch.features.batch.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.videobatch.features.batch.api.dto.BatchDto;
import uk.gegc.videobatch.features.batch.api.dto.TaskDto;
import uk.gegc.videobatch.features.batch.application.BatchQueryService;
import uk.gegc.videobatch.features.batch.domain.model.Batch;
import uk.gegc.videobatch.features.batch.domain.repository.BatchRepository;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;
import uk.gegc.videobatch.features.batch.infra.mapping.BatchMapper;
import uk.gegc.videobatch.features.batch.infra.mapping.TaskMapper;
import uk.gegc.videobatch.features.reconciliation.application.BatchReconciler;
import uk.gegc.videobatch.shared.exception.ResourceNotFoundException;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class BatchQueryServiceImpl implements BatchQueryService {

    private final BatchRepository batchRepository;
    private final VideoTaskRepository taskRepository;
    private final BatchReconciler reconciler;
    private final BatchMapper batchMapper;
    private final TaskMapper taskMapper;

    @Override
    @Transactional(readOnly = true)
    public Page<BatchDto> listBatches(UUID ownerId, Pageable pageable) {
        return batchRepository.findByOwnerIdAndDeletedAtIsNullOrderByCreatedAtDesc(ownerId, pageable)
                .map(batchMapper::toDto);
    }

    @Override
    @Transactional(readOnly = true)
    public BatchDto getBatch(UUID ownerId, UUID batchId) {
        return batchMapper.toDto(loadOwned(ownerId, batchId));
    }

    // Not transactional: the reconciler commits its corrections before the read below.
    @Override
    public List<TaskDto> listTasks(UUID ownerId, UUID batchId) {
        loadOwned(ownerId, batchId);
        reconciler.reconcileBatch(batchId);
        return taskMapper.toDtos(taskRepository.findByBatchIdAndDeletedAtIsNullOrderByCreatedAtAsc(batchId));
    }

    private Batch loadOwned(UUID ownerId, UUID batchId) {
        return batchRepository.findByIdAndOwnerIdAndDeletedAtIsNull(batchId, ownerId)
                .orElseThrow(() -> new ResourceNotFoundException("Batch " + batchId + " not found"));
    }
}
