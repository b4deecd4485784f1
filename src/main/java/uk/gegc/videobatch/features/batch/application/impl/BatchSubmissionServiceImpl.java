package uk.gegc.videobatch.features.batch.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import uk.gegc.videobatch.features.batch.api.dto.BatchSubmissionRequest;
import uk.gegc.videobatch.features.batch.api.dto.BatchSubmissionResult;
import uk.gegc.videobatch.features.batch.application.BatchAggregateService;
import uk.gegc.videobatch.features.batch.application.BatchSubmissionService;
import uk.gegc.videobatch.features.batch.application.SubmissionRateLimiter;
import uk.gegc.videobatch.features.batch.config.AdmissionProperties;
import uk.gegc.videobatch.features.batch.domain.events.TasksReadyEvent;
import uk.gegc.videobatch.features.batch.domain.exception.DuplicateSubmissionException;
import uk.gegc.videobatch.features.batch.domain.exception.SubmissionValidationException;
import uk.gegc.videobatch.features.batch.domain.model.Batch;
import uk.gegc.videobatch.features.batch.domain.model.IdempotencyRecord;
import uk.gegc.videobatch.features.batch.domain.model.TaskStatus;
import uk.gegc.videobatch.features.batch.domain.model.VideoTask;
import uk.gegc.videobatch.features.batch.domain.repository.BatchRepository;
import uk.gegc.videobatch.features.batch.domain.repository.IdempotencyRecordRepository;
import uk.gegc.videobatch.features.batch.domain.repository.VideoTaskRepository;
import uk.gegc.videobatch.features.ledger.application.CreditLedgerService;
import uk.gegc.videobatch.features.ledger.domain.exception.InsufficientCreditsException;
import uk.gegc.videobatch.features.pricing.application.PricingTable;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

@Slf4j
@Service
public class BatchSubmissionServiceImpl implements BatchSubmissionService {

    private final BatchRepository batchRepository;
    private final VideoTaskRepository taskRepository;
    private final IdempotencyRecordRepository idempotencyRepository;
    private final CreditLedgerService ledgerService;
    private final PricingTable pricingTable;
    private final SubmissionRateLimiter rateLimiter;
    private final BatchAggregateService aggregateService;
    private final AdmissionProperties properties;
    private final ApplicationEventPublisher eventPublisher;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    // Admission of one owner is serialized so two submissions cannot both pass the balance check.
    // Owners share a fixed set of stripes, so unrelated owners may occasionally wait on each other.
    static final int LOCK_STRIPES = 64;
    private final ReentrantLock[] ownerLocks = new ReentrantLock[LOCK_STRIPES];

    public BatchSubmissionServiceImpl(BatchRepository batchRepository,
                                      VideoTaskRepository taskRepository,
                                      IdempotencyRecordRepository idempotencyRepository,
                                      CreditLedgerService ledgerService,
                                      PricingTable pricingTable,
                                      SubmissionRateLimiter rateLimiter,
                                      BatchAggregateService aggregateService,
                                      AdmissionProperties properties,
                                      ApplicationEventPublisher eventPublisher,
                                      PlatformTransactionManager transactionManager,
                                      Clock clock) {
        this.batchRepository = batchRepository;
        this.taskRepository = taskRepository;
        this.idempotencyRepository = idempotencyRepository;
        this.ledgerService = ledgerService;
        this.pricingTable = pricingTable;
        this.rateLimiter = rateLimiter;
        this.aggregateService = aggregateService;
        this.properties = properties;
        this.eventPublisher = eventPublisher;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        for (int i = 0; i < LOCK_STRIPES; i++) {
            ownerLocks[i] = new ReentrantLock();
        }
    }

    @Override
    public BatchSubmissionResult submit(UUID ownerId, BatchSubmissionRequest request, String idempotencyKey) {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId is required");
        }
        ValidSubmission submission = validate(request);
        String key = normalizeKey(idempotencyKey);

        ReentrantLock lock = lockFor(ownerId);
        lock.lock();
        try {
            Optional<BatchSubmissionResult> replay = findReplay(ownerId, key);
            if (replay.isPresent()) {
                log.info("Replayed submission for owner {} with idempotency key {} -> batch {}",
                        ownerId, key, replay.get().batchId());
                return replay.get();
            }

            rateLimiter.check(ownerId);

            int unitCost = pricingTable.unitCost(submission.model(), submission.duration(), submission.size());
            long totalCost = (long) unitCost * submission.count();

            BatchSubmissionResult result = transactionTemplate.execute(status ->
                    persist(ownerId, submission, key, unitCost, totalCost));

            rateLimiter.record(ownerId);
            log.info("Admitted batch {} for owner {}: {} x {} credits", result.batchId(), ownerId,
                    submission.count(), unitCost);
            return result;
        } finally {
            lock.unlock();
        }
    }

    private BatchSubmissionResult persist(UUID ownerId, ValidSubmission submission, String key,
                                          int unitCost, long totalCost) {
        long balance = ledgerService.balanceOf(ownerId);
        if (balance < totalCost) {
            throw new InsufficientCreditsException(
                    String.format("Insufficient credits: required %d, available %d", totalCost, balance),
                    totalCost, balance);
        }

        LocalDateTime now = LocalDateTime.now(clock);

        Batch batch = new Batch();
        batch.setOwnerId(ownerId);
        batch.setPrompt(submission.prompt());
        batch.setModel(submission.model());
        batch.setOrientation(submission.orientation());
        batch.setSize(submission.size());
        batch.setDuration(submission.duration());
        batch.setRequestedCount(submission.count());
        batch.setMediaReference(submission.mediaReference());
        batch.setUnitCost(unitCost);
        batch.setCreatedAt(now);
        batch.setUpdatedAt(now);
        batch = batchRepository.save(batch);

        ledgerService.debitForBatch(ownerId, batch.getId(), totalCost);

        List<VideoTask> tasks = new ArrayList<>(submission.count());
        for (int i = 0; i < submission.count(); i++) {
            VideoTask task = new VideoTask();
            task.setBatchId(batch.getId());
            task.setOwnerId(ownerId);
            task.setPrompt(submission.prompt());
            task.setModel(submission.model());
            task.setOrientation(submission.orientation());
            task.setSize(submission.size());
            task.setDuration(submission.duration());
            task.setMediaReference(submission.mediaReference());
            task.setUnitCost(unitCost);
            task.setStatus(TaskStatus.QUEUED);
            task.setRetries(0);
            // distinct creation instants keep FIFO order stable on rebuild
            task.setCreatedAt(now.plusNanos(i * 1000L));
            task.setUpdatedAt(now);
            tasks.add(task);
        }
        List<UUID> taskIds = taskRepository.saveAll(tasks).stream().map(VideoTask::getId).toList();

        if (key != null) {
            IdempotencyRecord record = idempotencyRepository.findByOwnerIdAndIdempotencyKey(ownerId, key)
                    .orElseGet(IdempotencyRecord::new);
            record.setOwnerId(ownerId);
            record.setIdempotencyKey(key);
            record.setBatchId(batch.getId());
            record.setCreatedAt(now);
            idempotencyRepository.save(record);
        }

        aggregateService.recompute(batch.getId());
        eventPublisher.publishEvent(new TasksReadyEvent(this, batch.getId(), taskIds));
        return BatchSubmissionResult.created(batch.getId(), totalCost);
    }

    private Optional<BatchSubmissionResult> findReplay(UUID ownerId, String key) {
        if (key == null) {
            return Optional.empty();
        }
        Optional<IdempotencyRecord> existing = idempotencyRepository.findByOwnerIdAndIdempotencyKey(ownerId, key);
        if (existing.isEmpty()) {
            return Optional.empty();
        }
        IdempotencyRecord record = existing.get();
        LocalDateTime windowStart = LocalDateTime.now(clock).minus(properties.getIdempotencyWindow());
        if (!record.getCreatedAt().isAfter(windowStart)) {
            return Optional.empty();
        }
        if (record.getBatchId() != null
                && batchRepository.findByIdAndOwnerIdAndDeletedAtIsNull(record.getBatchId(), ownerId).isPresent()) {
            return Optional.of(BatchSubmissionResult.replay(record.getBatchId()));
        }
        throw new DuplicateSubmissionException(key);
    }

    private ValidSubmission validate(BatchSubmissionRequest request) {
        if (request == null) {
            throw new SubmissionValidationException("request", "Submission is required");
        }
        String prompt = request.prompt() == null ? "" : request.prompt().trim();
        if (prompt.isEmpty()) {
            throw new SubmissionValidationException("prompt", "Prompt is required");
        }
        if (prompt.length() > properties.getMaxPromptLength()) {
            throw new SubmissionValidationException("prompt",
                    "Prompt exceeds " + properties.getMaxPromptLength() + " characters");
        }
        String model = trimToNull(request.model());
        if (model == null || !pricingTable.models().contains(model)) {
            throw new SubmissionValidationException("model", "Unsupported model: " + request.model());
        }
        String orientation = trimToNull(request.orientation());
        if (orientation == null || !properties.getOrientations().contains(orientation)) {
            throw new SubmissionValidationException("orientation", "Unsupported orientation: " + request.orientation());
        }
        String size = trimToNull(request.size());
        if (size == null || request.duration() == null) {
            throw new SubmissionValidationException("size", "Duration and size are required");
        }
        if (!pricingTable.isAllowed(model, request.duration(), size)) {
            throw new SubmissionValidationException("duration",
                    String.format("Model %s does not support duration %ds with size %s", model, request.duration(), size));
        }
        Integer count = request.count();
        if (count == null || count < properties.getMinCount() || count > properties.getMaxCount()) {
            throw new SubmissionValidationException("count",
                    String.format("Count must be between %d and %d", properties.getMinCount(), properties.getMaxCount()));
        }
        return new ValidSubmission(prompt, model, orientation, size, request.duration(), count,
                trimToNull(request.mediaReference()));
    }

    ReentrantLock lockFor(UUID ownerId) {
        return ownerLocks[Math.floorMod(ownerId.hashCode(), LOCK_STRIPES)];
    }

    private String normalizeKey(String idempotencyKey) {
        String key = trimToNull(idempotencyKey);
        if (key != null && key.length() > properties.getMaxIdempotencyKeyLength()) {
            throw new SubmissionValidationException("idempotencyKey",
                    "Idempotency key exceeds " + properties.getMaxIdempotencyKeyLength() + " characters");
        }
        return key;
    }

    private static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private record ValidSubmission(String prompt, String model, String orientation, String size,
                                   int duration, int count, String mediaReference) {
    }
}
