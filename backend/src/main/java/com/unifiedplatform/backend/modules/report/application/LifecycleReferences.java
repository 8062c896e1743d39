package com.unifiedplatform.backend.modules.report.application;

import java.util.UUID;

/**
 * Request and event ids a report or evaluation points at, after both were checked to exist and agree.
 */
public record LifecycleReferences(UUID requestId, UUID eventId) {
}
