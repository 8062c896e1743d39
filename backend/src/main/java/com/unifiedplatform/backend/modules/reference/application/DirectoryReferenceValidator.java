package com.unifiedplatform.backend.modules.reference.application;

import com.unifiedplatform.backend.global.common.Identifiers;
import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.BranchRepository;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.PlatformUserRepository;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.ResourceRepository;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

/**
 * {@link ReferenceValidator} backed by the reference collections of the same store.
 * Users resolve by email (case-insensitive) or by id.
 */
@Component
@Transactional(readOnly = true)
public class DirectoryReferenceValidator implements ReferenceValidator {

    private final BranchRepository branchRepository;
    private final ResourceRepository resourceRepository;
    private final PlatformUserRepository platformUserRepository;

    public DirectoryReferenceValidator(
            BranchRepository branchRepository,
            ResourceRepository resourceRepository,
            PlatformUserRepository platformUserRepository
    ) {
        this.branchRepository = branchRepository;
        this.resourceRepository = resourceRepository;
        this.platformUserRepository = platformUserRepository;
    }

    @Override
    public boolean exists(ReferenceKind kind, String key) {
        if (kind == null || key == null || key.isBlank()) {
            return false;
        }
        String trimmed = key.trim();
        return switch (kind) {
            case BRANCH -> branchRepository.existsByCode(trimmed);
            case RESOURCE -> Identifiers.tryParse(trimmed).map(resourceRepository::existsById).orElse(false);
            case USER -> platformUserRepository.existsByEmailIgnoreCase(trimmed)
                    || Identifiers.tryParse(trimmed).map(platformUserRepository::existsById).orElse(false);
        };
    }
}
