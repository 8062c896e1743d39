package com.unifiedplatform.backend.modules.reference.domain;

public enum ResourceAvailability {
    AVAILABLE,
    RESERVED,
    MAINTENANCE
}
