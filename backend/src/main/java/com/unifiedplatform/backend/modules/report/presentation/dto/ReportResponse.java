package com.unifiedplatform.backend.modules.report.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ReportResponse(
        UUID id,
        UUID requestId,
        UUID eventId,
        String submittedBy,
        String summary,
        Integer attendeesCount,
        List<String> photos,
        OffsetDateTime createdAt
) {
}
