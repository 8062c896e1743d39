package com.unifiedplatform.backend.modules.reference.presentation;

import java.util.List;

import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.reference.application.ReferenceDataService;
import com.unifiedplatform.backend.modules.reference.presentation.dto.BranchResponse;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateBranchRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateRoleRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateUserRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.RoleResponse;
import com.unifiedplatform.backend.modules.reference.presentation.dto.UserResponse;

import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class ReferenceDataController {

    private final ReferenceDataService referenceDataService;

    public ReferenceDataController(ReferenceDataService referenceDataService) {
        this.referenceDataService = referenceDataService;
    }

    @PostMapping("/branches")
    public ResponseEntity<CreatedResponse> createBranch(@Valid @RequestBody CreateBranchRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.withMessage(referenceDataService.createBranch(request).getId(), "Branch created"));
    }

    @GetMapping("/branches")
    public ResponseEntity<List<BranchResponse>> listBranches() {
        return ResponseEntity.ok(referenceDataService.listBranches());
    }

    @PostMapping("/roles")
    public ResponseEntity<CreatedResponse> createRole(@Valid @RequestBody CreateRoleRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.of(referenceDataService.createRole(request).getId()));
    }

    @GetMapping("/roles")
    public ResponseEntity<List<RoleResponse>> listRoles() {
        return ResponseEntity.ok(referenceDataService.listRoles());
    }

    @PostMapping("/users")
    public ResponseEntity<CreatedResponse> createUser(@Valid @RequestBody CreateUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.of(referenceDataService.createUser(request).getId()));
    }

    @GetMapping("/users")
    public ResponseEntity<List<UserResponse>> listUsers(
            @RequestParam(name = "branch_code", required = false) String branchCode
    ) {
        return ResponseEntity.ok(referenceDataService.listUsers(branchCode));
    }
}
