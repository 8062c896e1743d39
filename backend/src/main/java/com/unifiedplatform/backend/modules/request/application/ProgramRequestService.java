package com.unifiedplatform.backend.modules.request.application;

import java.math.BigDecimal;
import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.config.PlatformProperties;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.reference.application.ReferenceValidator;
import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.domain.ProgramType;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestRepository;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestSearchCondition;
import com.unifiedplatform.backend.modules.request.presentation.dto.BudgetItemInput;
import com.unifiedplatform.backend.modules.request.presentation.dto.BudgetItemResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.ProgramRequestResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.SubmitProgramRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class ProgramRequestService {

    public static final String REQUEST_NOT_FOUND = "REQUEST_NOT_FOUND";
    public static final String INVALID_TRANSITION = "INVALID_TRANSITION";

    private static final Logger log = LoggerFactory.getLogger(ProgramRequestService.class);

    private final ProgramRequestRepository programRequestRepository;
    private final ReferenceValidator referenceValidator;
    private final PlatformProperties platformProperties;

    public ProgramRequestService(
            ProgramRequestRepository programRequestRepository,
            ReferenceValidator referenceValidator,
            PlatformProperties platformProperties
    ) {
        this.programRequestRepository = programRequestRepository;
        this.referenceValidator = referenceValidator;
        this.platformProperties = platformProperties;
    }

    public ProgramRequest submit(SubmitProgramRequest request) {
        ProgramType programType = WireCodes.parse(ProgramType.class, request.programType(), "program_type");
        ensureNonNegativeBudget(request.budget());

        String branchCode = request.branchCode().trim();
        if (!referenceValidator.exists(ReferenceKind.BRANCH, branchCode)) {
            throw ProblemException.validation("UNKNOWN_BRANCH", "branch_code " + branchCode + " does not exist");
        }
        String requestedBy = trimToNull(request.requestedBy());
        if (requestedBy != null && !referenceValidator.exists(ReferenceKind.USER, requestedBy)) {
            throw ProblemException.validation("UNKNOWN_USER", "requested_by " + requestedBy + " does not exist");
        }

        ProgramRequest programRequest = new ProgramRequest();
        programRequest.setBranchCode(branchCode);
        programRequest.setProgramTitle(request.programTitle().trim());
        programRequest.setProgramType(programType);
        programRequest.setDescription(trimToNull(request.description()));
        programRequest.setProposedDate(request.proposedDate());
        programRequest.setLocation(trimToNull(request.location()));
        programRequest.setRequestedBy(requestedBy);
        for (BudgetItemInput item : request.budget()) {
            programRequest.addBudgetItem(item.name().trim(), item.amount());
        }

        ProgramRequest saved = programRequestRepository.save(programRequest);
        log.info("Program request {} submitted by branch {} ({})", saved.getId(), branchCode, WireCodes.code(programType));
        return saved;
    }

    /**
     * Lists requests matching every non-null field of {@code condition}. An empty condition returns the whole
     * collection.
     */
    @Transactional(readOnly = true)
    public List<ProgramRequestResponse> listRequests(ProgramRequestSearchCondition condition) {
        if (condition.isUnfiltered()) {
            log.debug("Unfiltered program request listing requested");
        }
        return programRequestRepository.search(condition).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public ProgramRequestResponse getRequest(UUID requestId) {
        return programRequestRepository.findById(requestId)
                .map(this::toResponse)
                .orElseThrow(() -> notFound(requestId));
    }

    public ProgramRequestResponse startReview(UUID requestId) {
        ProgramRequest programRequest = programRequestRepository
                .lockForDecision(requestId, platformProperties.store().lockTimeout())
                .orElseThrow(() -> notFound(requestId));
        ensureTransitionAllowed(programRequest, ProgramRequestStatus.UNDER_REVIEW);
        programRequest.transitionTo(ProgramRequestStatus.UNDER_REVIEW);
        ProgramRequest saved = programRequestRepository.saveAndFlush(programRequest);
        log.info("Program request {} moved to review", requestId);
        return toResponse(saved);
    }

    static void ensureTransitionAllowed(ProgramRequest programRequest, ProgramRequestStatus target) {
        ProgramRequestStatus current = programRequest.getStatus();
        if (!current.canTransitionTo(target)) {
            log.debug("Refused transition of request {} from {} to {}", programRequest.getId(), current, target);
            throw ProblemException.conflict(INVALID_TRANSITION,
                    "request is " + WireCodes.code(current) + " and cannot become " + WireCodes.code(target));
        }
    }

    static ProblemException notFound(Object requestId) {
        return ProblemException.notFound(REQUEST_NOT_FOUND, "program request " + requestId + " does not exist");
    }

    ProgramRequestResponse toResponse(ProgramRequest programRequest) {
        List<BudgetItemResponse> budget = programRequest.getBudget().stream()
                .map(item -> new BudgetItemResponse(item.getName(), item.getAmount()))
                .toList();
        return new ProgramRequestResponse(
                programRequest.getId(),
                programRequest.getBranchCode(),
                programRequest.getProgramTitle(),
                WireCodes.code(programRequest.getProgramType()),
                programRequest.getDescription(),
                programRequest.getProposedDate(),
                programRequest.getLocation(),
                budget,
                programRequest.getRequestedBy(),
                WireCodes.code(programRequest.getStatus()),
                programRequest.getCreatedAt(),
                programRequest.getUpdatedAt()
        );
    }

    private void ensureNonNegativeBudget(List<BudgetItemInput> budget) {
        for (int i = 0; i < budget.size(); i++) {
            BigDecimal amount = budget.get(i).amount();
            if (amount == null || amount.signum() < 0) {
                throw ProblemException.validation("NEGATIVE_BUDGET_AMOUNT", "budget[" + i + "].amount must be >= 0");
            }
        }
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
