package com.unifiedplatform.backend.modules.report.infrastructure.persistence;

import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.Identifiers;

/**
 * Filter shared by report and evaluation listings. {@code matchesNothing} is set when a supplied id is not a
 * UUID, in which case no stored fact can match.
 */
public record FactSearchCondition(UUID requestId, UUID eventId, boolean matchesNothing) {

    public static FactSearchCondition of(String rawRequestId, String rawEventId) {
        boolean malformed = false;
        UUID requestId = null;
        UUID eventId = null;
        if (rawRequestId != null && !rawRequestId.isBlank()) {
            Optional<UUID> parsed = Identifiers.tryParse(rawRequestId);
            malformed = parsed.isEmpty();
            requestId = parsed.orElse(null);
        }
        if (rawEventId != null && !rawEventId.isBlank()) {
            Optional<UUID> parsed = Identifiers.tryParse(rawEventId);
            malformed = malformed || parsed.isEmpty();
            eventId = parsed.orElse(null);
        }
        return new FactSearchCondition(requestId, eventId, malformed);
    }
}
