package com.unifiedplatform.backend.modules.request.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.request.domain.Approval;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ApprovalRepository extends JpaRepository<Approval, UUID> {

    @Query("""
            select a from Approval a
             where (:requestId is null or a.programRequest.id = :requestId)
             order by a.createdAt asc, a.id asc
            """)
    List<Approval> search(@Param("requestId") UUID requestId);

    long countByProgramRequestId(UUID requestId);
}
