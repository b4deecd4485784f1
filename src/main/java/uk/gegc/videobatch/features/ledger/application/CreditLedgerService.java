package uk.gegc.videobatch.features.ledger.application;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import uk.gegc.videobatch.features.ledger.api.dto.CreditTransactionDto;

import java.util.UUID;

/**
 * Append-only credit ledger. There is no stored balance: every read aggregates the
 * owner's transactions, and every write appends a new one.
 */
public interface CreditLedgerService {

    /**
     * Current balance, the sum of all deltas of the owner (0 without transactions).
     */
    long balanceOf(UUID ownerId);

    /**
     * Append the single debit charged when a batch is admitted.
     *
     * @param amount positive number of credits to take
     */
    void debitForBatch(UUID ownerId, UUID batchId, long amount);

    /**
     * Give back the cost of a failed task unless a positive entry already references it.
     *
     * <p>The check and the insert are two statements without a uniqueness constraint, so this
     * is safe only while a task is finalized by one actor at a time.
     *
     * @return {@code true} when a refund row was written by this call
     */
    boolean refundTask(UUID ownerId, UUID batchId, UUID taskId, int amount);

    /**
     * Manual signed correction.
     *
     * @throws IllegalArgumentException when delta is 0 or the reason is blank or longer than 64 chars
     */
    CreditTransactionDto adjust(UUID ownerId, int delta, String reason);

    Page<CreditTransactionDto> history(UUID ownerId, Pageable pageable);
}
