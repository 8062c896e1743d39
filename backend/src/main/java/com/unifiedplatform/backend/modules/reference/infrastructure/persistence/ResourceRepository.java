package com.unifiedplatform.backend.modules.reference.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.reference.domain.Resource;
import com.unifiedplatform.backend.modules.reference.domain.ResourceType;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ResourceRepository extends JpaRepository<Resource, UUID> {

    @Query("""
            select r from Resource r
             where (:branchCode is null or r.branchCode = :branchCode)
               and (:type is null or r.type = :type)
             order by r.createdAt asc, r.id asc
            """)
    List<Resource> search(@Param("branchCode") String branchCode, @Param("type") ResourceType type);
}
