package com.unifiedplatform.backend.modules.reference.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record CreateRoleRequest(
        @NotBlank(message = "NAME_REQUIRED")
        String name,
        String description
) {
}
