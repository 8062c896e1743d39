package com.unifiedplatform.backend.modules.event.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record EventResponse(
        UUID id,
        UUID requestId,
        String title,
        String branchCode,
        OffsetDateTime startTime,
        OffsetDateTime endTime,
        String location,
        List<UUID> resources,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
