package uk.gegc.videobatch.features.batch.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record TaskDto(
        UUID id,
        UUID batchId,
        String status,
        String errorSummary,
        String resultLocator,
        String progress,
        String remoteJobId,
        int retries,
        LocalDateTime remoteStartedAt,
        LocalDateTime remoteFinishedAt,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
