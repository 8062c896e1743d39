package com.unifiedplatform.backend.modules.reference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.reference.domain.PlatformUser;

import org.springframework.data.jpa.repository.JpaRepository;

public interface PlatformUserRepository extends JpaRepository<PlatformUser, UUID> {

    boolean existsByEmailIgnoreCase(String email);

    List<PlatformUser> findAllByOrderByCreatedAtAscIdAsc();

    List<PlatformUser> findByBranchCodeOrderByCreatedAtAscIdAsc(String branchCode);
}
