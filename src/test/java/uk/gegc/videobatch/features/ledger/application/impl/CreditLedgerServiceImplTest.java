package uk.gegc.videobatch.features.ledger.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import uk.gegc.videobatch.BaseUnitTest;
import uk.gegc.videobatch.features.ledger.domain.model.CreditTransaction;
import uk.gegc.videobatch.features.ledger.domain.repository.CreditTransactionRepository;
import uk.gegc.videobatch.features.ledger.infra.mapping.CreditTransactionMapper;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@DisplayName("CreditLedgerServiceImpl")
class CreditLedgerServiceImplTest extends BaseUnitTest {

    @Mock
    private CreditTransactionRepository transactionRepository;

    @Mock
    private CreditTransactionMapper transactionMapper;

    private CreditLedgerServiceImpl ledgerService;

    private final UUID ownerId = UUID.randomUUID();
    private final UUID batchId = UUID.randomUUID();
    private final UUID taskId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        ledgerService = new CreditLedgerServiceImpl(transactionRepository, transactionMapper, clock);
    }

    @Test
    @DisplayName("balanceOf is the aggregated sum of deltas")
    void balanceOf_returnsSum() {
        when(transactionRepository.sumDeltaByOwnerId(ownerId)).thenReturn(85L);

        assertThat(ledgerService.balanceOf(ownerId)).isEqualTo(85L);
    }

    @Nested
    @DisplayName("debitForBatch")
    class DebitForBatch {

        @Test
        @DisplayName("appends a single negative entry tagged with the batch")
        void appendsNegativeEntry() {
            when(transactionRepository.save(any(CreditTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

            ledgerService.debitForBatch(ownerId, batchId, 30);

            ArgumentCaptor<CreditTransaction> captor = ArgumentCaptor.forClass(CreditTransaction.class);
            verify(transactionRepository).save(captor.capture());
            CreditTransaction tx = captor.getValue();
            assertThat(tx.getOwnerId()).isEqualTo(ownerId);
            assertThat(tx.getDelta()).isEqualTo(-30);
            assertThat(tx.getReason()).isEqualTo("batch_debit:" + batchId);
            assertThat(tx.getRefBatchId()).isEqualTo(batchId);
            assertThat(tx.getRefTaskId()).isNull();
        }

        @Test
        @DisplayName("rejects non-positive amounts")
        void rejectsNonPositive() {
            assertThatThrownBy(() -> ledgerService.debitForBatch(ownerId, batchId, 0))
                    .isInstanceOf(IllegalArgumentException.class);
            verify(transactionRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("refundTask")
    class RefundTask {

        @Test
        @DisplayName("writes a positive entry when none references the task yet")
        void writesRefund() {
            when(transactionRepository.existsByRefTaskIdAndDeltaGreaterThan(taskId, 0)).thenReturn(false);
            when(transactionRepository.save(any(CreditTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

            boolean refunded = ledgerService.refundTask(ownerId, batchId, taskId, 15);

            assertThat(refunded).isTrue();
            ArgumentCaptor<CreditTransaction> captor = ArgumentCaptor.forClass(CreditTransaction.class);
            verify(transactionRepository).save(captor.capture());
            assertThat(captor.getValue().getDelta()).isEqualTo(15);
            assertThat(captor.getValue().getRefTaskId()).isEqualTo(taskId);
            assertThat(captor.getValue().getReason()).isEqualTo("task_refund:" + taskId);
        }

        @Test
        @DisplayName("does nothing when a positive entry already references the task")
        void skipsDuplicate() {
            when(transactionRepository.existsByRefTaskIdAndDeltaGreaterThan(taskId, 0)).thenReturn(true);

            boolean refunded = ledgerService.refundTask(ownerId, batchId, taskId, 15);

            assertThat(refunded).isFalse();
            verify(transactionRepository, never()).save(any());
        }
    }

    @Nested
    @DisplayName("adjust")
    class Adjust {

        @Test
        @DisplayName("rejects a zero delta")
        void rejectsZeroDelta() {
            assertThatThrownBy(() -> ledgerService.adjust(ownerId, 0, "manual"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("delta");
        }

        @Test
        @DisplayName("rejects blank or over-long reasons")
        void rejectsBadReason() {
            assertThatThrownBy(() -> ledgerService.adjust(ownerId, 10, " "))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> ledgerService.adjust(ownerId, 10, "x".repeat(65)))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("appends the signed correction")
        void appendsCorrection() {
            when(transactionRepository.save(any(CreditTransaction.class))).thenAnswer(inv -> inv.getArgument(0));

            ledgerService.adjust(ownerId, -5, "support goodwill reversal");

            ArgumentCaptor<CreditTransaction> captor = ArgumentCaptor.forClass(CreditTransaction.class);
            verify(transactionRepository).save(captor.capture());
            assertThat(captor.getValue().getDelta()).isEqualTo(-5);
            assertThat(captor.getValue().getReason()).isEqualTo("support goodwill reversal");
            verify(transactionMapper).toDto(captor.getValue());
        }
    }
}
