package com.unifiedplatform.backend.modules.notification.presentation.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CreateNotificationRequest(
        @Email(message = "USER_EMAIL_INVALID")
        String userEmail,
        @Size(max = 32, message = "BRANCH_CODE_TOO_LONG")
        String branchCode,
        @NotBlank(message = "TITLE_REQUIRED")
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotBlank(message = "MESSAGE_REQUIRED")
        String message,
        String type,
        @JsonProperty("is_read")
        Boolean isRead
) {
}
