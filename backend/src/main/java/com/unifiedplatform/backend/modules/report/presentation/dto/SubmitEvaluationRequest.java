package com.unifiedplatform.backend.modules.report.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record SubmitEvaluationRequest(
        String requestId,
        String eventId,
        @NotNull(message = "SCORE_REQUIRED")
        @DecimalMin(value = "0", message = "SCORE_OUT_OF_RANGE")
        @DecimalMax(value = "100", message = "SCORE_OUT_OF_RANGE")
        @Digits(integer = 3, fraction = 2, message = "SCORE_PRECISION")
        BigDecimal score,
        @Size(max = 200, message = "METHODOLOGY_TOO_LONG")
        String methodology,
        String comments
) {
}
