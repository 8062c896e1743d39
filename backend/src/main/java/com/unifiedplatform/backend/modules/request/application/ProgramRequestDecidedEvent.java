package com.unifiedplatform.backend.modules.request.application;

import java.util.UUID;

import com.unifiedplatform.backend.modules.request.domain.ApprovalDecision;

/**
 * Published inside the approval transaction; listeners that act on it should do so after commit.
 */
public record ProgramRequestDecidedEvent(
        UUID requestId,
        UUID approvalId,
        String branchCode,
        String programTitle,
        String requestedBy,
        ApprovalDecision decision,
        String approvedBy,
        String notes
) {
}
