package com.unifiedplatform.backend.modules.request.presentation;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestService;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestSearchCondition;
import com.unifiedplatform.backend.modules.request.presentation.dto.ProgramRequestResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.SubmitProgramRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/program-requests")
public class ProgramRequestController {

    private final ProgramRequestService programRequestService;

    public ProgramRequestController(ProgramRequestService programRequestService) {
        this.programRequestService = programRequestService;
    }

    @Operation(summary = "Submit a program request", description = "The request always starts as submitted.")
    @PostMapping
    public ResponseEntity<CreatedResponse> submitRequest(@Valid @RequestBody SubmitProgramRequest request) {
        ProgramRequest saved = programRequestService.submit(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.withStatus(saved.getId(), WireCodes.code(saved.getStatus())));
    }

    // TODO: accept page/size once the admin console stops relying on full listings.
    @Operation(summary = "List program requests", description = "Exact-match filters; no filter returns every request.")
    @GetMapping
    public ResponseEntity<List<ProgramRequestResponse>> listRequests(
            @Parameter(description = "submitted, under_review, approved or rejected")
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "branch_code", required = false) String branchCode
    ) {
        ProgramRequestSearchCondition condition = new ProgramRequestSearchCondition(
                WireCodes.parseNullable(ProgramRequestStatus.class, status, "status"),
                StringUtils.hasText(branchCode) ? branchCode.trim() : null
        );
        return ResponseEntity.ok(programRequestService.listRequests(condition));
    }

    @GetMapping("/{requestId}")
    public ResponseEntity<ProgramRequestResponse> getRequest(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(programRequestService.getRequest(requestId));
    }

    @Operation(summary = "Move a submitted request under review")
    @PostMapping("/{requestId}/review")
    public ResponseEntity<ProgramRequestResponse> startReview(@PathVariable("requestId") UUID requestId) {
        return ResponseEntity.ok(programRequestService.startReview(requestId));
    }
}
