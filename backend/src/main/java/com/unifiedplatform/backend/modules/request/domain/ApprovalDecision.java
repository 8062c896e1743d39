package com.unifiedplatform.backend.modules.request.domain;

public enum ApprovalDecision {
    APPROVED(ProgramRequestStatus.APPROVED),
    REJECTED(ProgramRequestStatus.REJECTED);

    private final ProgramRequestStatus targetStatus;

    ApprovalDecision(ProgramRequestStatus targetStatus) {
        this.targetStatus = targetStatus;
    }

    public ProgramRequestStatus targetStatus() {
        return targetStatus;
    }
}
