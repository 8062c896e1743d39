package com.unifiedplatform.backend.modules.schema.presentation;

import java.util.List;

import com.unifiedplatform.backend.modules.schema.application.SchemaIntrospectionService;
import com.unifiedplatform.backend.modules.schema.presentation.dto.SchemaModelResponse;

import io.swagger.v3.oas.annotations.Operation;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/schema")
public class SchemaController {

    private final SchemaIntrospectionService schemaIntrospectionService;

    public SchemaController(SchemaIntrospectionService schemaIntrospectionService) {
        this.schemaIntrospectionService = schemaIntrospectionService;
    }

    @Operation(summary = "Describe stored models", description = "Lightweight reflection for admin tooling.")
    @GetMapping
    public ResponseEntity<List<SchemaModelResponse>> describeModels() {
        return ResponseEntity.ok(schemaIntrospectionService.describeModels());
    }
}
