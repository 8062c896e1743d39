package com.unifiedplatform.backend.modules.request.domain;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a program request.
 *
 * <pre>
 * SUBMITTED ──► UNDER_REVIEW ──► APPROVED | REJECTED
 *     └──────────────────────────► APPROVED | REJECTED
 * </pre>
 *
 * Review may be skipped. {@link #APPROVED} and {@link #REJECTED} are terminal.
 */
public enum ProgramRequestStatus {
    SUBMITTED,
    UNDER_REVIEW,
    APPROVED,
    REJECTED;

    public Set<ProgramRequestStatus> allowedSuccessors() {
        return switch (this) {
            case SUBMITTED -> EnumSet.of(UNDER_REVIEW, APPROVED, REJECTED);
            case UNDER_REVIEW -> EnumSet.of(APPROVED, REJECTED);
            case APPROVED, REJECTED -> EnumSet.noneOf(ProgramRequestStatus.class);
        };
    }

    public boolean canTransitionTo(ProgramRequestStatus next) {
        return next != null && allowedSuccessors().contains(next);
    }

    public boolean isTerminal() {
        return allowedSuccessors().isEmpty();
    }
}
