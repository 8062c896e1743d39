package com.unifiedplatform.backend.modules.reference.presentation.dto;

import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record UserResponse(
        UUID id,
        String fullName,
        String email,
        String branchCode,
        String role,
        @JsonProperty("is_active")
        boolean isActive
) {
}
