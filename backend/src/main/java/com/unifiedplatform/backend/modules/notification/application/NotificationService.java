package com.unifiedplatform.backend.modules.notification.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.notification.domain.Notification;
import com.unifiedplatform.backend.modules.notification.domain.NotificationType;
import com.unifiedplatform.backend.modules.notification.infrastructure.persistence.NotificationRepository;
import com.unifiedplatform.backend.modules.notification.presentation.dto.CreateNotificationRequest;
import com.unifiedplatform.backend.modules.notification.presentation.dto.NotificationResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class NotificationService {

    public static final String NOTIFICATION_NOT_FOUND = "NOTIFICATION_NOT_FOUND";

    private static final Logger log = LoggerFactory.getLogger(NotificationService.class);

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository, Clock clock) {
        this.notificationRepository = notificationRepository;
        this.clock = clock;
    }

    public Notification create(CreateNotificationRequest request) {
        NotificationType type = WireCodes.parseNullable(NotificationType.class, request.type(), "type");
        Notification notification = send(
                trimToNull(request.userEmail()),
                trimToNull(request.branchCode()),
                request.title().trim(),
                request.message().trim(),
                type != null ? type : NotificationType.INFO
        );
        if (Boolean.TRUE.equals(request.isRead())) {
            notification.markRead(OffsetDateTime.now(clock));
        }
        return notification;
    }

    /**
     * Stores a notification for the given targets. Either target may be null.
     */
    public Notification send(String userEmail, String branchCode, String title, String message, NotificationType type) {
        Notification notification = new Notification();
        notification.setUserEmail(userEmail);
        notification.setBranchCode(branchCode);
        notification.setTitle(title);
        notification.setMessage(message);
        notification.setType(type);
        Notification saved = notificationRepository.save(notification);
        log.debug("Notification {} ({}) stored for user={} branch={}",
                saved.getId(), WireCodes.code(type), userEmail, branchCode);
        return saved;
    }

    /**
     * Same as {@link #send} but always commits on its own, for callers that run after their own transaction
     * has finished.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification sendDetached(String userEmail, String branchCode, String title, String message,
                                     NotificationType type) {
        return send(userEmail, branchCode, title, message, type);
    }

    @Transactional(readOnly = true)
    public List<NotificationResponse> listNotifications(String userEmail, String branchCode) {
        return notificationRepository.search(trimToNull(userEmail), trimToNull(branchCode)).stream()
                .map(this::toResponse)
                .toList();
    }

    public NotificationResponse markRead(UUID notificationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> ProblemException.notFound(
                        NOTIFICATION_NOT_FOUND, "notification " + notificationId + " does not exist"));
        notification.markRead(OffsetDateTime.now(clock));
        return toResponse(notification);
    }

    private NotificationResponse toResponse(Notification notification) {
        return new NotificationResponse(
                notification.getId(),
                notification.getUserEmail(),
                notification.getBranchCode(),
                notification.getTitle(),
                notification.getMessage(),
                WireCodes.code(notification.getType()),
                notification.isRead(),
                notification.getReadAt(),
                notification.getCreatedAt()
        );
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
