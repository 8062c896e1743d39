package com.unifiedplatform.backend.modules.reference.presentation.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateBranchRequest(
        @NotBlank(message = "CODE_REQUIRED")
        @Size(max = 32, message = "CODE_TOO_LONG")
        String code,
        @NotBlank(message = "NAME_REQUIRED")
        @Size(max = 120, message = "NAME_TOO_LONG")
        String name,
        @Size(max = 120, message = "REGION_TOO_LONG")
        String region,
        String managerName,
        @Email(message = "MANAGER_EMAIL_INVALID")
        String managerEmail
) {
}
