package com.unifiedplatform.backend.modules.notification.presentation.dto;

import java.time.OffsetDateTime;
import java.util.UUID;

import com.fasterxml.jackson.annotation.JsonProperty;

public record NotificationResponse(
        UUID id,
        String userEmail,
        String branchCode,
        String title,
        String message,
        String type,
        @JsonProperty("is_read")
        boolean isRead,
        OffsetDateTime readAt,
        OffsetDateTime createdAt
) {
}
