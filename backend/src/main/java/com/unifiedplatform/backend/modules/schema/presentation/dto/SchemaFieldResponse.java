package com.unifiedplatform.backend.modules.schema.presentation.dto;

public record SchemaFieldResponse(String name, String type) {
}
