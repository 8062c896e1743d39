package com.unifiedplatform.backend.modules.event.domain;

import java.util.EnumSet;
import java.util.Set;

public enum EventStatus {
    SCHEDULED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED;

    public Set<EventStatus> allowedSuccessors() {
        return switch (this) {
            case SCHEDULED -> EnumSet.of(IN_PROGRESS, CANCELLED);
            case IN_PROGRESS -> EnumSet.of(COMPLETED, CANCELLED);
            case COMPLETED, CANCELLED -> EnumSet.noneOf(EventStatus.class);
        };
    }

    public boolean canTransitionTo(EventStatus next) {
        return next != null && allowedSuccessors().contains(next);
    }
}
