package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.math.BigDecimal;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record BudgetItemInput(
        @NotBlank(message = "BUDGET_NAME_REQUIRED")
        @Size(max = 120, message = "BUDGET_NAME_TOO_LONG")
        String name,
        @NotNull(message = "BUDGET_AMOUNT_REQUIRED")
        BigDecimal amount
) {
}
