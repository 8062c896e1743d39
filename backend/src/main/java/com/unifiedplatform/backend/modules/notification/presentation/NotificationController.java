package com.unifiedplatform.backend.modules.notification.presentation;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.notification.application.NotificationService;
import com.unifiedplatform.backend.modules.notification.domain.Notification;
import com.unifiedplatform.backend.modules.notification.presentation.dto.CreateNotificationRequest;
import com.unifiedplatform.backend.modules.notification.presentation.dto.NotificationResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/notifications")
public class NotificationController {

    private final NotificationService notificationService;

    public NotificationController(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @PostMapping
    public ResponseEntity<CreatedResponse> createNotification(@Valid @RequestBody CreateNotificationRequest request) {
        Notification saved = notificationService.create(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(CreatedResponse.of(saved.getId()));
    }

    @GetMapping
    public ResponseEntity<List<NotificationResponse>> listNotifications(
            @RequestParam(name = "user_email", required = false) String userEmail,
            @RequestParam(name = "branch_code", required = false) String branchCode
    ) {
        return ResponseEntity.ok(notificationService.listNotifications(userEmail, branchCode));
    }

    @PatchMapping("/{notificationId}/read")
    public ResponseEntity<NotificationResponse> markRead(@PathVariable("notificationId") UUID notificationId) {
        return ResponseEntity.ok(notificationService.markRead(notificationId));
    }
}
