package com.unifiedplatform.backend.modules.reference.application;

import java.util.List;
import java.util.Locale;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.reference.domain.Branch;
import com.unifiedplatform.backend.modules.reference.domain.PlatformUser;
import com.unifiedplatform.backend.modules.reference.domain.Role;
import com.unifiedplatform.backend.modules.reference.domain.RoleName;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.BranchRepository;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.PlatformUserRepository;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.RoleRepository;
import com.unifiedplatform.backend.modules.reference.presentation.dto.BranchResponse;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateBranchRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateRoleRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateUserRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.RoleResponse;
import com.unifiedplatform.backend.modules.reference.presentation.dto.UserResponse;

import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Flat CRUD over branches, roles and users.
 */
@Service
@Transactional
public class ReferenceDataService {

    private final BranchRepository branchRepository;
    private final RoleRepository roleRepository;
    private final PlatformUserRepository platformUserRepository;

    public ReferenceDataService(
            BranchRepository branchRepository,
            RoleRepository roleRepository,
            PlatformUserRepository platformUserRepository
    ) {
        this.branchRepository = branchRepository;
        this.roleRepository = roleRepository;
        this.platformUserRepository = platformUserRepository;
    }

    public Branch createBranch(CreateBranchRequest request) {
        String code = request.code().trim();
        if (branchRepository.existsByCode(code)) {
            throw ProblemException.conflict("BRANCH_CODE_TAKEN", "branch_code " + code + " already exists");
        }
        Branch branch = new Branch();
        branch.setCode(code);
        branch.setName(request.name().trim());
        branch.setRegion(trimToNull(request.region()));
        branch.setManagerName(trimToNull(request.managerName()));
        branch.setManagerEmail(trimToNull(request.managerEmail()));
        try {
            return branchRepository.saveAndFlush(branch);
        } catch (DataIntegrityViolationException ex) {
            throw ProblemException.conflict("BRANCH_CODE_TAKEN", "branch_code " + code + " already exists");
        }
    }

    @Transactional(readOnly = true)
    public List<BranchResponse> listBranches() {
        return branchRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(branch -> new BranchResponse(
                        branch.getId(),
                        branch.getCode(),
                        branch.getName(),
                        branch.getRegion(),
                        branch.getManagerName(),
                        branch.getManagerEmail(),
                        branch.getCreatedAt()
                ))
                .toList();
    }

    public Role createRole(CreateRoleRequest request) {
        Role role = new Role();
        role.setName(WireCodes.parse(RoleName.class, request.name(), "name"));
        role.setDescription(trimToNull(request.description()));
        return roleRepository.save(role);
    }

    @Transactional(readOnly = true)
    public List<RoleResponse> listRoles() {
        return roleRepository.findAllByOrderByCreatedAtAscIdAsc().stream()
                .map(role -> new RoleResponse(role.getId(), WireCodes.code(role.getName()), role.getDescription()))
                .toList();
    }

    public PlatformUser createUser(CreateUserRequest request) {
        String email = request.email().trim().toLowerCase(Locale.ROOT);
        if (platformUserRepository.existsByEmailIgnoreCase(email)) {
            throw ProblemException.conflict("USER_EMAIL_TAKEN", "email " + email + " already registered");
        }
        PlatformUser user = new PlatformUser();
        user.setFullName(request.fullName().trim());
        user.setEmail(email);
        user.setBranchCode(trimToNull(request.branchCode()));
        user.setRole(request.role().trim());
        user.setActive(request.isActive() == null || request.isActive());
        return platformUserRepository.save(user);
    }

    @Transactional(readOnly = true)
    public List<UserResponse> listUsers(String branchCode) {
        String filter = trimToNull(branchCode);
        List<PlatformUser> users = filter == null
                ? platformUserRepository.findAllByOrderByCreatedAtAscIdAsc()
                : platformUserRepository.findByBranchCodeOrderByCreatedAtAscIdAsc(filter);
        return users.stream()
                .map(user -> new UserResponse(
                        user.getId(),
                        user.getFullName(),
                        user.getEmail(),
                        user.getBranchCode(),
                        user.getRole(),
                        user.isActive()
                ))
                .toList();
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
