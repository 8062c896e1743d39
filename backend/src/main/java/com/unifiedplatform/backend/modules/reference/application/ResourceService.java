package com.unifiedplatform.backend.modules.reference.application;

import java.util.List;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.modules.reference.domain.Resource;
import com.unifiedplatform.backend.modules.reference.domain.ResourceAvailability;
import com.unifiedplatform.backend.modules.reference.domain.ResourceType;
import com.unifiedplatform.backend.modules.reference.infrastructure.persistence.ResourceRepository;
import com.unifiedplatform.backend.modules.reference.presentation.dto.CreateResourceRequest;
import com.unifiedplatform.backend.modules.reference.presentation.dto.ResourceResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

@Service
@Transactional
public class ResourceService {

    private final ResourceRepository resourceRepository;

    public ResourceService(ResourceRepository resourceRepository) {
        this.resourceRepository = resourceRepository;
    }

    public Resource createResource(CreateResourceRequest request) {
        Resource resource = new Resource();
        resource.setName(request.name().trim());
        resource.setType(WireCodes.parse(ResourceType.class, request.type(), "type"));
        resource.setBranchCode(StringUtils.hasText(request.branchCode()) ? request.branchCode().trim() : null);
        resource.setCapacity(request.capacity());
        ResourceAvailability availability = WireCodes.parseNullable(
                ResourceAvailability.class, request.availabilityStatus(), "availability_status");
        resource.setAvailabilityStatus(availability != null ? availability : ResourceAvailability.AVAILABLE);
        return resourceRepository.save(resource);
    }

    @Transactional(readOnly = true)
    public List<ResourceResponse> listResources(String branchCode, String type) {
        ResourceType typeFilter = WireCodes.parseNullable(ResourceType.class, type, "type");
        String branchFilter = StringUtils.hasText(branchCode) ? branchCode.trim() : null;
        return resourceRepository.search(branchFilter, typeFilter).stream()
                .map(resource -> new ResourceResponse(
                        resource.getId(),
                        resource.getName(),
                        WireCodes.code(resource.getType()),
                        resource.getBranchCode(),
                        resource.getCapacity(),
                        WireCodes.code(resource.getAvailabilityStatus())
                ))
                .toList();
    }
}
