package com.unifiedplatform.backend.modules.report.presentation;

import java.util.List;

import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.report.application.ReportService;
import com.unifiedplatform.backend.modules.report.domain.Report;
import com.unifiedplatform.backend.modules.report.infrastructure.persistence.FactSearchCondition;
import com.unifiedplatform.backend.modules.report.presentation.dto.ReportResponse;
import com.unifiedplatform.backend.modules.report.presentation.dto.SubmitReportRequest;

import io.swagger.v3.oas.annotations.Operation;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/reports")
public class ReportController {

    private final ReportService reportService;

    public ReportController(ReportService reportService) {
        this.reportService = reportService;
    }

    @Operation(summary = "Submit a post-event report",
            description = "request_id and event_id are optional but must exist and agree with each other.")
    @PostMapping
    public ResponseEntity<CreatedResponse> submitReport(@Valid @RequestBody SubmitReportRequest request) {
        Report saved = reportService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CreatedResponse.of(saved.getId()));
    }

    @GetMapping
    public ResponseEntity<List<ReportResponse>> listReports(
            @RequestParam(name = "request_id", required = false) String requestId,
            @RequestParam(name = "event_id", required = false) String eventId
    ) {
        return ResponseEntity.ok(reportService.listReports(FactSearchCondition.of(requestId, eventId)));
    }
}
