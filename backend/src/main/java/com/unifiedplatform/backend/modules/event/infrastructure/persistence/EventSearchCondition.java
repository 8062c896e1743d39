package com.unifiedplatform.backend.modules.event.infrastructure.persistence;

import java.util.UUID;

import com.unifiedplatform.backend.modules.event.domain.EventStatus;

public record EventSearchCondition(
        String branchCode,
        EventStatus status,
        UUID requestId
) {
}
