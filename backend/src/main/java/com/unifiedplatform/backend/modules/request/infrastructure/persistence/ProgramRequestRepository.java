package com.unifiedplatform.backend.modules.request.infrastructure.persistence;

import java.util.UUID;

import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;

import org.springframework.data.jpa.repository.JpaRepository;

public interface ProgramRequestRepository extends JpaRepository<ProgramRequest, UUID>, ProgramRequestRepositoryCustom {
}
