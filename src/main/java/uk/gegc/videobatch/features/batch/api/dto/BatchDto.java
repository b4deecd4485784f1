package uk.gegc.videobatch.features.batch.api.dto;

import java.time.LocalDateTime;
import java.util.UUID;

public record BatchDto(
        UUID id,
        UUID ownerId,
        String prompt,
        String model,
        String orientation,
        String size,
        int duration,
        int requestedCount,
        String mediaReference,
        int unitCost,
        int total,
        int completed,
        int failed,
        int running,
        int queued,
        int cancelled,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {}
