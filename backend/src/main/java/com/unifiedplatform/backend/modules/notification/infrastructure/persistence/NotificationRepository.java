package com.unifiedplatform.backend.modules.notification.infrastructure.persistence;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.modules.notification.domain.Notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    @Query("""
            select n from Notification n
             where (:userEmail is null or lower(n.userEmail) = lower(:userEmail))
               and (:branchCode is null or n.branchCode = :branchCode)
             order by n.createdAt asc, n.id asc
            """)
    List<Notification> search(@Param("userEmail") String userEmail, @Param("branchCode") String branchCode);
}
