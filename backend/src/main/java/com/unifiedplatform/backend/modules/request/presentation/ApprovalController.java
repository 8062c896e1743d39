package com.unifiedplatform.backend.modules.request.presentation;

import java.util.List;

import com.unifiedplatform.backend.modules.request.application.ApprovalService;
import com.unifiedplatform.backend.modules.request.presentation.dto.ApprovalRecordedResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.ApprovalResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.RecordApprovalRequest;

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
@RequestMapping("/approvals")
public class ApprovalController {

    private final ApprovalService approvalService;

    public ApprovalController(ApprovalService approvalService) {
        this.approvalService = approvalService;
    }

    @Operation(
            summary = "Record an approval decision",
            description = "404 when the request does not exist, 409 INVALID_TRANSITION when it is already decided."
    )
    @PostMapping
    public ResponseEntity<ApprovalRecordedResponse> recordApproval(@Valid @RequestBody RecordApprovalRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(approvalService.recordApproval(request));
    }

    @GetMapping
    public ResponseEntity<List<ApprovalResponse>> listApprovals(
            @RequestParam(name = "request_id", required = false) String requestId
    ) {
        return ResponseEntity.ok(approvalService.listApprovals(requestId));
    }
}
