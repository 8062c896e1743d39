package com.unifiedplatform.backend.modules.report.presentation.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import jakarta.validation.constraints.Size;

public record SubmitReportRequest(
        String requestId,
        String eventId,
        @Size(max = 255, message = "SUBMITTED_BY_TOO_LONG")
        String submittedBy,
        @NotBlank(message = "SUMMARY_REQUIRED")
        String summary,
        @PositiveOrZero(message = "ATTENDEES_COUNT_NEGATIVE")
        Integer attendeesCount,
        List<@NotBlank(message = "PHOTO_REQUIRED") String> photos
) {

    public SubmitReportRequest {
        photos = photos == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(photos));
    }
}
