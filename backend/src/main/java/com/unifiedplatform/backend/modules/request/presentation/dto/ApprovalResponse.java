package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record ApprovalResponse(
        UUID id,
        UUID requestId,
        String approvedBy,
        String decision,
        String notes,
        OffsetDateTime createdAt
) {
}
