package com.unifiedplatform.backend.modules.request.domain;

public enum ProgramType {
    STUDENT_ACTIVITY,
    COMMUNITY_SERVICE,
    VOLUNTEERING
}
