package com.unifiedplatform.backend.modules.reference.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateUserRequest(
        @NotBlank(message = "FULL_NAME_REQUIRED")
        @Size(max = 120, message = "FULL_NAME_TOO_LONG")
        String fullName,
        @NotBlank(message = "EMAIL_REQUIRED")
        @Email(message = "EMAIL_INVALID")
        String email,
        String branchCode,
        @NotBlank(message = "ROLE_REQUIRED")
        String role,
        @JsonProperty("is_active")
        Boolean isActive
) {
}
