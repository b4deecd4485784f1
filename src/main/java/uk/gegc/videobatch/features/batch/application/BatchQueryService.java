package uk.gegc.videobatch.features.batch.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.videobatch.features.batch.api.dto.BatchDto;
import uk.gegc.videobatch.features.batch.api.dto.TaskDto;

import java.util.List;
import java.util.UUID;

public interface BatchQueryService {

    /**
     * Non-deleted batches of the owner, newest first.
     */
    Page<BatchDto> listBatches(UUID ownerId, Pageable pageable);

    BatchDto getBatch(UUID ownerId, UUID batchId);

    /**
     * Tasks of a batch in creation order. The batch is reconciled before it is read.
     */
    List<TaskDto> listTasks(UUID ownerId, UUID batchId);
}
