package uk.gegc.videobatch.features.ledger.domain.repository;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import uk.gegc.videobatch.features.ledger.domain.model.CreditTransaction;

import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@TestPropertySource(properties = {
        "spring.flyway.enabled=false",
        "spring.jpa.hibernate.ddl-auto=create-drop"
})
class CreditTransactionRepositoryTest {

    @Autowired
    private CreditTransactionRepository repository;

    @Autowired
    private TestEntityManager entityManager;

    @Test
    @DisplayName("sumDeltaByOwnerId adds every delta of the owner and ignores others")
    void sumDeltaByOwnerId_sumsOwnerOnly() {
        UUID owner = UUID.randomUUID();
        UUID other = UUID.randomUUID();
        persist(owner, 100, "adjustment", null);
        persist(owner, -30, "batch_debit:x", null);
        persist(owner, 15, "task_refund:y", UUID.randomUUID());
        persist(other, 500, "adjustment", null);

        assertThat(repository.sumDeltaByOwnerId(owner)).isEqualTo(85L);
        assertThat(repository.sumDeltaByOwnerId(other)).isEqualTo(500L);
    }

    @Test
    @DisplayName("sumDeltaByOwnerId is 0 for an owner without transactions")
    void sumDeltaByOwnerId_noRows_isZero() {
        assertThat(repository.sumDeltaByOwnerId(UUID.randomUUID())).isZero();
    }

    @Test
    @DisplayName("existsByRefTaskIdAndDeltaGreaterThan only sees positive entries")
    void existsPositiveForTask() {
        UUID owner = UUID.randomUUID();
        UUID task = UUID.randomUUID();
        persist(owner, -15, "batch_debit:x", task);

        assertThat(repository.existsByRefTaskIdAndDeltaGreaterThan(task, 0)).isFalse();

        persist(owner, 15, "task_refund:" + task, task);

        assertThat(repository.existsByRefTaskIdAndDeltaGreaterThan(task, 0)).isTrue();
    }

    @Test
    @DisplayName("history is returned newest first")
    void findByOwner_newestFirst() {
        UUID owner = UUID.randomUUID();
        CreditTransaction older = persist(owner, 100, "adjustment", null, LocalDateTime.of(2026, 1, 1, 10, 0));
        CreditTransaction newer = persist(owner, -10, "batch_debit:x", null, LocalDateTime.of(2026, 1, 1, 11, 0));

        var page = repository.findByOwnerIdOrderByCreatedAtDesc(owner, PageRequest.of(0, 10));

        assertThat(page.getContent()).extracting(CreditTransaction::getId)
                .containsExactly(newer.getId(), older.getId());
    }

    private CreditTransaction persist(UUID owner, int delta, String reason, UUID taskId) {
        return persist(owner, delta, reason, taskId, LocalDateTime.now());
    }

    private CreditTransaction persist(UUID owner, int delta, String reason, UUID taskId, LocalDateTime createdAt) {
        CreditTransaction tx = new CreditTransaction();
        tx.setOwnerId(owner);
        tx.setDelta(delta);
        tx.setReason(reason);
        tx.setRefTaskId(taskId);
        tx.setCreatedAt(createdAt);
        CreditTransaction saved = entityManager.persist(tx);
        entityManager.flush();
        return saved;
    }
}
