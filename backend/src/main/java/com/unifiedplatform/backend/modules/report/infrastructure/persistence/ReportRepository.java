package com.unifiedplatform.backend.modules.report.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.report.domain.Report;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ReportRepository extends JpaRepository<Report, UUID> {

    @Query("""
            select r from Report r
             where (:requestId is null or r.requestId = :requestId)
               and (:eventId is null or r.eventId = :eventId)
             order by r.createdAt asc, r.id asc
            """)
    List<Report> search(@Param("requestId") UUID requestId, @Param("eventId") UUID eventId);
}
