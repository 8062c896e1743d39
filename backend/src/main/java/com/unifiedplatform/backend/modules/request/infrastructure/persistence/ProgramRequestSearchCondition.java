package com.unifiedplatform.backend.modules.request.infrastructure.persistence;

import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;

/**
 * Exact-match filters for listing program requests; a {@code null} field does not filter.
 */
public record ProgramRequestSearchCondition(
        ProgramRequestStatus status,
        String branchCode
) {

    public static ProgramRequestSearchCondition unfiltered() {
        return new ProgramRequestSearchCondition(null, null);
    }

    public boolean isUnfiltered() {
        return status == null && branchCode == null;
    }
}
