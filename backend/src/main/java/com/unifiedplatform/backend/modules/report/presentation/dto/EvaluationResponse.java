package com.unifiedplatform.backend.modules.report.presentation.dto;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

public record EvaluationResponse(
        UUID id,
        UUID requestId,
        UUID eventId,
        BigDecimal score,
        String methodology,
        String comments,
        OffsetDateTime createdAt
) {
}
