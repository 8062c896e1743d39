package com.unifiedplatform.backend.modules.request.presentation.dto;

import java.util.UUID;

/**
 * Result of a decision: the new approval's identity and the status the request now has.
 */
public record ApprovalRecordedResponse(UUID id, UUID requestId, String status) {
}
