package com.unifiedplatform.backend.modules.event.infrastructure.persistence;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.modules.event.domain.EventStatus;
import com.unifiedplatform.backend.modules.event.domain.ProgramEvent;

import jakarta.persistence.LockModeType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ProgramEventRepository extends JpaRepository<ProgramEvent, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select e from ProgramEvent e where e.id = :id")
    Optional<ProgramEvent> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select e from ProgramEvent e
             where (:branchCode is null or e.branchCode = :branchCode)
               and (:status is null or e.status = :status)
               and (:requestId is null or e.programRequest.id = :requestId)
             order by e.createdAt asc, e.id asc
            """)
    List<ProgramEvent> search(
            @Param("branchCode") String branchCode,
            @Param("status") EventStatus status,
            @Param("requestId") UUID requestId
    );

    default List<ProgramEvent> search(EventSearchCondition condition) {
        return search(condition.branchCode(), condition.status(), condition.requestId());
    }
}
