package com.unifiedplatform.backend.modules.request.infrastructure.persistence;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;

public interface ProgramRequestRepositoryCustom {

    List<ProgramRequest> search(ProgramRequestSearchCondition condition);

    /**
     * Loads the request with a row lock held until the surrounding transaction ends, waiting at most
     * {@code lockTimeout} for a concurrent holder.
     */
    Optional<ProgramRequest> lockForDecision(UUID id, Duration lockTimeout);
}
