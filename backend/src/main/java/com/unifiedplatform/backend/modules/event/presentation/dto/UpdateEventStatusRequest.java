package com.unifiedplatform.backend.modules.event.presentation.dto;

import jakarta.validation.constraints.NotBlank;

public record UpdateEventStatusRequest(
        @NotBlank(message = "STATUS_REQUIRED")
        String status
) {
}
