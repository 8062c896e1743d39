package com.unifiedplatform.backend.modules.reference.domain;

public enum ResourceType {
    VENUE,
    EQUIPMENT,
    IT_SUPPORT,
    MEDIA,
    TRANSPORT
}
