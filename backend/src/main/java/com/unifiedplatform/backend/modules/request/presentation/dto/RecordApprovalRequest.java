package com.unifiedplatform.backend.modules.request.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record RecordApprovalRequest(
        @NotBlank(message = "REQUEST_ID_REQUIRED")
        String requestId,
        @NotBlank(message = "APPROVED_BY_REQUIRED")
        String approvedBy,
        @NotBlank(message = "DECISION_REQUIRED")
        String decision,
        String notes
) {
}
