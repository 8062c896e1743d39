package com.unifiedplatform.backend.modules.request.application;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.Identifiers;
import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.config.PlatformProperties;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.reference.application.ReferenceValidator;
import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;
import com.unifiedplatform.backend.modules.request.domain.Approval;
import com.unifiedplatform.backend.modules.request.domain.ApprovalDecision;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ApprovalRepository;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestRepository;
import com.unifiedplatform.backend.modules.request.presentation.dto.ApprovalRecordedResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.ApprovalResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.RecordApprovalRequest;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Records approval decisions.
 *
 * <p>The approval row and the request's new status are written in one transaction while the request row is
 * locked, so a reader never sees one without the other and two decisions on the same request are serialised:
 * the second one re-reads a terminal status and is refused with {@code INVALID_TRANSITION}.
 */
@Service
@Transactional
public class ApprovalService {

    private static final Logger log = LoggerFactory.getLogger(ApprovalService.class);

    private final ProgramRequestRepository programRequestRepository;
    private final ApprovalRepository approvalRepository;
    private final ReferenceValidator referenceValidator;
    private final ApplicationEventPublisher eventPublisher;
    private final PlatformProperties platformProperties;

    public ApprovalService(
            ProgramRequestRepository programRequestRepository,
            ApprovalRepository approvalRepository,
            ReferenceValidator referenceValidator,
            ApplicationEventPublisher eventPublisher,
            PlatformProperties platformProperties
    ) {
        this.programRequestRepository = programRequestRepository;
        this.approvalRepository = approvalRepository;
        this.referenceValidator = referenceValidator;
        this.eventPublisher = eventPublisher;
        this.platformProperties = platformProperties;
    }

    public ApprovalRecordedResponse recordApproval(RecordApprovalRequest request) {
        ApprovalDecision decision = WireCodes.parse(ApprovalDecision.class, request.decision(), "decision");
        String approvedBy = request.approvedBy().trim();
        if (!referenceValidator.exists(ReferenceKind.USER, approvedBy)) {
            throw ProblemException.validation("UNKNOWN_USER", "approved_by " + approvedBy + " does not exist");
        }

        UUID requestId = Identifiers.resolveOrNotFound(
                request.requestId(), ProgramRequestService.REQUEST_NOT_FOUND, "program request");
        ProgramRequest programRequest = programRequestRepository
                .lockForDecision(requestId, platformProperties.store().lockTimeout())
                .orElseThrow(() -> ProgramRequestService.notFound(requestId));

        ProgramRequestStatus target = decision.targetStatus();
        ProgramRequestService.ensureTransitionAllowed(programRequest, target);

        Approval approval = approvalRepository.save(
                new Approval(programRequest, approvedBy, decision, trimToNull(request.notes())));
        programRequest.transitionTo(target);
        // Flush while still inside the transaction so a failing status write rolls the approval back with it.
        programRequestRepository.saveAndFlush(programRequest);

        eventPublisher.publishEvent(new ProgramRequestDecidedEvent(
                programRequest.getId(),
                approval.getId(),
                programRequest.getBranchCode(),
                programRequest.getProgramTitle(),
                programRequest.getRequestedBy(),
                decision,
                approvedBy,
                approval.getNotes()
        ));
        log.info("Program request {} {} by {} (approval {})",
                requestId, WireCodes.code(target), approvedBy, approval.getId());
        return new ApprovalRecordedResponse(approval.getId(), requestId, WireCodes.code(target));
    }

    @Transactional(readOnly = true)
    public List<ApprovalResponse> listApprovals(String requestId) {
        UUID requestFilter = null;
        if (requestId != null && !requestId.isBlank()) {
            Optional<UUID> parsed = Identifiers.tryParse(requestId);
            if (parsed.isEmpty()) {
                return List.of();
            }
            requestFilter = parsed.get();
        }
        return approvalRepository.search(requestFilter).stream()
                .map(approval -> new ApprovalResponse(
                        approval.getId(),
                        approval.getProgramRequest().getId(),
                        approval.getApprovedBy(),
                        WireCodes.code(approval.getDecision()),
                        approval.getNotes(),
                        approval.getCreatedAt()
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
