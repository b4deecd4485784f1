package uk.gegc.videobatch.features.ledger.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record CreditTransactionDto(
        UUID id,
        UUID ownerId,
        int delta,
        String reason,
        UUID refBatchId,
        UUID refTaskId,
        LocalDateTime createdAt
) {}
