package com.unifiedplatform.backend.modules.request.infrastructure.persistence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import jakarta.persistence.EntityManager;
import jakarta.persistence.LockModeType;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import org.springframework.stereotype.Repository;
import org.springframework.util.StringUtils;

import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;

@Repository
public class ProgramRequestRepositoryImpl implements ProgramRequestRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ProgramRequest> search(ProgramRequestSearchCondition condition) {
        Objects.requireNonNull(condition, "condition must not be null");

        List<String> whereClauses = new ArrayList<>();
        Map<String, Object> params = new HashMap<>();

        if (condition.status() != null) {
            whereClauses.add("pr.status = :status");
            params.put("status", condition.status());
        }
        if (StringUtils.hasText(condition.branchCode())) {
            whereClauses.add("pr.branchCode = :branchCode");
            params.put("branchCode", condition.branchCode().trim());
        }

        String whereSql = whereClauses.isEmpty() ? "" : " where " + String.join(" and ", whereClauses);
        TypedQuery<ProgramRequest> query = entityManager.createQuery(
                "select pr from ProgramRequest pr" + whereSql + " order by pr.createdAt asc, pr.id asc",
                ProgramRequest.class);
        params.forEach(query::setParameter);
        return query.getResultList();
    }

    @Override
    public Optional<ProgramRequest> lockForDecision(UUID id, Duration lockTimeout) {
        Objects.requireNonNull(id, "id must not be null");
        // PostgreSQL ignores JPA lock timeout hints on FOR UPDATE; bound the wait for this transaction only.
        long millis = Math.max(1L, lockTimeout.toMillis());
        entityManager.createNativeQuery("SET LOCAL lock_timeout = '" + millis + "ms'").executeUpdate();
        return Optional.ofNullable(entityManager.find(ProgramRequest.class, id, LockModeType.PESSIMISTIC_WRITE));
    }
}
