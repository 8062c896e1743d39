package com.unifiedplatform.backend.modules.reference.presentation.dto;

import java.util.UUID;

public record RoleResponse(UUID id, String name, String description) {
}
