package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.math.BigDecimal;

public record BudgetItemResponse(String name, BigDecimal amount) {
}
