package com.unifiedplatform.backend.modules.schema.presentation.dto;

import java.util.List;

public record SchemaModelResponse(String name, List<SchemaFieldResponse> fields) {
}
