package com.unifiedplatform.backend.modules.reference.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

public record BranchResponse(
        UUID id,
        String code,
        String name,
        String region,
        String managerName,
        String managerEmail,
        OffsetDateTime createdAt
) {
}
