package com.unifiedplatform.backend.modules.report.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.report.domain.Evaluation;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface EvaluationRepository extends JpaRepository<Evaluation, UUID> {

    @Query("""
            select e from Evaluation e
             where (:requestId is null or e.requestId = :requestId)
               and (:eventId is null or e.eventId = :eventId)
             order by e.createdAt asc, e.id asc
            """)
    List<Evaluation> search(@Param("requestId") UUID requestId, @Param("eventId") UUID eventId);
}
