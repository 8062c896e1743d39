package com.unifiedplatform.backend.modules.event.presentation.dto;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record ScheduleEventRequest(
        String requestId,
        @NotBlank(message = "TITLE_REQUIRED")
        @Size(max = 200, message = "TITLE_TOO_LONG")
        String title,
        @NotBlank(message = "BRANCH_CODE_REQUIRED")
        String branchCode,
        @NotNull(message = "START_TIME_REQUIRED")
        OffsetDateTime startTime,
        @NotNull(message = "END_TIME_REQUIRED")
        OffsetDateTime endTime,
        @Size(max = 200, message = "LOCATION_TOO_LONG")
        String location,
        List<@NotBlank(message = "RESOURCE_REQUIRED") String> resources,
        String status
) {

    public ScheduleEventRequest {
        resources = resources == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(resources));
    }
}
