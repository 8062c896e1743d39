package com.unifiedplatform.backend.modules.reference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.reference.domain.Branch;

import org.springframework.data.jpa.repository.JpaRepository;

public interface BranchRepository extends JpaRepository<Branch, UUID> {

    boolean existsByCode(String code);

    List<Branch> findAllByOrderByCreatedAtAscIdAsc();
}
