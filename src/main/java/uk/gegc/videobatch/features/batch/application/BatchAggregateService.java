package uk.gegc.videobatch.features.batch.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.videobatch.features.batch.domain.model.Batch;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.repository.BatchRepository;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.Map;
import java.util.UUID;

/**
 * The only writer of batch counters. Counters are recounted from the task rows every time,
 * never incremented.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BatchAggregateService {

    private final BatchRepository batchRepository;
    private final VideoTaskRepository taskRepository;
    private final Clock clock;

    @Transactional
    public void recompute(UUID batchId) {
        Batch batch = batchRepository.findById(batchId).orElse(null);
        if (batch == null) {
            log.debug("Skipping aggregate recompute, batch {} not found", batchId);
            return;
        }
        Map<TaskStatus, Long> counts = new EnumMap<>(TaskStatus.class);
        for (VideoTaskRepository.StatusCount row : taskRepository.countByStatus(batchId)) {
            counts.put(row.getStatus(), row.getTotal());
        }
        batch.applyStatusCounts(counts, LocalDateTime.now(clock));
        batchRepository.save(batch);
    }
}
