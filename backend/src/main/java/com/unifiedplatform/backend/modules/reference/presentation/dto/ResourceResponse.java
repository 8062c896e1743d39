package com.unifiedplatform.backend.modules.reference.presentation.dto;

import java.util.UUID;

public record ResourceResponse(
        UUID id,
        String name,
        String type,
        String branchCode,
        Integer capacity,
        String availabilityStatus
) {
}
