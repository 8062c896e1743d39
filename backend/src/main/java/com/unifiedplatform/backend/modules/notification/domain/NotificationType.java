package com.unifiedplatform.backend.modules.notification.domain;

public enum NotificationType {
    INFO,
    SUCCESS,
    WARNING,
    ERROR
}
