package uk.gegc.videobatch.features.ledger.application.impl;

import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.videobatch.features.ledger.api.dto.CreditTransactionDto;
import uk.gegc.videobatch.features.ledger.application.CreditLedgerService;
import uk.gegc.videobatch.features.ledger.application.LedgerStructuredLogger;
import uk.gegc.videobatch.features.ledger.domain.model.CreditReason;
import uk.gegc.videobatch.features.ledger.domain.model.CreditTransaction;
import uk.gegc.videobatch.features.ledger.domain.repository.CreditTransactionRepository;
import uk.gegc.videobatch.features.ledger.infra.mapping.CreditTransactionMapper;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CreditLedgerServiceImpl implements CreditLedgerService {

    private static final Logger log = LoggerFactory.getLogger(CreditLedgerServiceImpl.class);
    private static final int MAX_REASON_LENGTH = 64;

    private final CreditTransactionRepository transactionRepository;
    private final CreditTransactionMapper transactionMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public long balanceOf(UUID ownerId) {
        return transactionRepository.sumDeltaByOwnerId(ownerId);
    }

    @Override
    @Transactional
    public void debitForBatch(UUID ownerId, UUID batchId, long amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("amount must be > 0");
        }
        if (amount > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("amount exceeds a single ledger entry");
        }
        String reason = CreditReason.BATCH_DEBIT.forReference(batchId);
        append(ownerId, -(int) amount, reason, batchId, null);

        LedgerStructuredLogger.logLedgerWrite(log, "Debited {} credits from owner {} for batch {}",
                ownerId, reason, -amount, batchId, null, transactionRepository.sumDeltaByOwnerId(ownerId),
                amount, ownerId, batchId);
    }

    @Override
    @Transactional
    public boolean refundTask(UUID ownerId, UUID batchId, UUID taskId, int amount) {
        if (amount <= 0) {
            throw new IllegalArgumentException("refund amount must be > 0");
        }
        if (transactionRepository.existsByRefTaskIdAndDeltaGreaterThan(taskId, 0)) {
            log.debug("Refund for task {} already recorded, skipping", taskId);
            return false;
        }
        String reason = CreditReason.TASK_REFUND.forReference(taskId);
        append(ownerId, amount, reason, batchId, taskId);

        LedgerStructuredLogger.logLedgerWrite(log, "Refunded {} credits to owner {} for task {}",
                ownerId, reason, amount, batchId, taskId, transactionRepository.sumDeltaByOwnerId(ownerId),
                amount, ownerId, taskId);
        return true;
    }

    @Override
    @Transactional
    public CreditTransactionDto adjust(UUID ownerId, int delta, String reason) {
        if (delta == 0) {
            throw new IllegalArgumentException("delta must not be 0");
        }
        if (reason == null || reason.isBlank() || reason.length() > MAX_REASON_LENGTH) {
            throw new IllegalArgumentException("reason must be 1-" + MAX_REASON_LENGTH + " characters");
        }
        CreditTransaction tx = append(ownerId, delta, reason.trim(), null, null);

        LedgerStructuredLogger.logLedgerWrite(log, "Adjusted owner {} by {} credits",
                ownerId, tx.getReason(), delta, null, null, transactionRepository.sumDeltaByOwnerId(ownerId),
                ownerId, delta);
        return transactionMapper.toDto(tx);
    }

    @Override
    @Transactional(readOnly = true)
    public Page<CreditTransactionDto> history(UUID ownerId, Pageable pageable) {
        return transactionRepository.findByOwnerIdOrderByCreatedAtDesc(ownerId, pageable)
                .map(transactionMapper::toDto);
    }

    private CreditTransaction append(UUID ownerId, int delta, String reason, UUID batchId, UUID taskId) {
        CreditTransaction tx = new CreditTransaction();
        tx.setOwnerId(ownerId);
        tx.setDelta(delta);
        tx.setReason(reason);
        tx.setRefBatchId(batchId);
        tx.setRefTaskId(taskId);
        tx.setCreatedAt(LocalDateTime.now(clock));
        return transactionRepository.save(tx);
    }
}
