package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

/**
 * Submission payload. A {@code status} sent by the client is not part of the contract and is ignored;
 * every request starts as {@code submitted}.
 */
public record SubmitProgramRequest(
        @NotBlank(message = "BRANCH_CODE_REQUIRED")
        String branchCode,
        @NotBlank(message = "PROGRAM_TITLE_REQUIRED")
        @Size(max = 200, message = "PROGRAM_TITLE_TOO_LONG")
        String programTitle,
        @NotBlank(message = "PROGRAM_TYPE_REQUIRED")
        String programType,
        String description,
        OffsetDateTime proposedDate,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        List<@NotNull(message = "BUDGET_ITEM_REQUIRED") @Valid BudgetItemInput> budget,
        String requestedBy
) {

    public SubmitProgramRequest {
        budget = budget == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(budget));
    }
}
