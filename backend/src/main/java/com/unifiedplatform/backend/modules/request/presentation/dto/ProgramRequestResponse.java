package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

public record ProgramRequestResponse(
        UUID id,
        String branchCode,
        String programTitle,
        String programType,
        String description,
        OffsetDateTime proposedDate,
        String location,
        List<BudgetItemResponse> budget,
        String requestedBy,
        String status,
        OffsetDateTime createdAt,
        OffsetDateTime updatedAt
) {
}
