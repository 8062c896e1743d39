package com.unifiedplatform.backend.modules.reference.presentation.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateResourceRequest(
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 120, message = "NAME_TOO_LONG")
        String name,
        @NotBlank(message = "TYPE_REQUIRED")
        String type,
        String branchCode,
        @Min(value = 0, message = "CAPACITY_NEGATIVE")
        Integer capacity,
        String availabilityStatus
) {
}
