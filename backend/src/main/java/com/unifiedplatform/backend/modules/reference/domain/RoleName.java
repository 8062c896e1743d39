package com.unifiedplatform.backend.modules.reference.domain;

public enum RoleName {
    ADMIN,
    HQ_MANAGER,
    BRANCH_MANAGER,
    COORDINATOR,
    REVIEWER,
    FINANCE,
    IT,
    QUALITY,
    VIEWER
}
