package com.unifiedplatform.backend.modules.reference.presentation;

import java.util.List;

import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.reference.application.ResourceService;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateResourceRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.ResourceResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/resources")
public class ResourceController {

    private final ResourceService resourceService;

    public ResourceController(ResourceService resourceService) {
        this.resourceService = resourceService;
    }

    @PostMapping
    public ResponseEntity<CreatedResponse> createResource(@Valid @RequestBody CreateResourceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.of(resourceService.createResource(request).getId()));
    }

    @Operation(summary = "List bookable resources", description = "Exact-match filters; both optional.")
    @GetMapping
    public ResponseEntity<List<ResourceResponse>> listResources(
            @Parameter(description = "Owning branch code")
            @RequestParam(name = "branch_code", required = false) String branchCode,
            @Parameter(description = "venue, equipment, it_support, media or transport")
            @RequestParam(name = "type", required = false) String type
    ) {
        return ResponseEntity.ok(resourceService.listResources(branchCode, type));
    }
}
