package com.unifiedplatform.backend.modules.event.application;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.Identifiers;
import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.event.domain.EventStatus;
import com.unifiedplatform.backend.modules.event.domain.ProgramEvent;
import com.unifiedplatform.backend.modules.event.infrastructure.persistence.EventSearchCondition;
import com.unifiedplatform.backend.modules.event.infrastructure.persistence.ProgramEventRepository;
import com.unifiedplatform.backend.modules.event.presentation.dto.EventResponse;
import com.unifiedplatform.backend.modules.event.presentation.dto.ScheduleEventRequest;
import com.unifiedplatform.backend.modules.reference.application.ReferenceValidator;
import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestService;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional
public class EventService {

    public static final String EVENT_NOT_FOUND = "EVENT_NOT_FOUND";
    public static final String REQUEST_NOT_APPROVED = "REQUEST_NOT_APPROVED";
    public static final String INVALID_EVENT_TRANSITION = "INVALID_EVENT_TRANSITION";

    private static final Logger log = LoggerFactory.getLogger(EventService.class);

    private final ProgramEventRepository programEventRepository;
    private final ProgramRequestRepository programRequestRepository;
    private final ReferenceValidator referenceValidator;

    public EventService(
            ProgramEventRepository programEventRepository,
            ProgramRequestRepository programRequestRepository,
            ReferenceValidator referenceValidator
    ) {
        this.programEventRepository = programEventRepository;
        this.programRequestRepository = programRequestRepository;
        this.referenceValidator = referenceValidator;
    }

    public ProgramEvent schedule(ScheduleEventRequest request) {
        if (!request.startTime().isBefore(request.endTime())) {
            throw ProblemException.validation("INVALID_TIME_RANGE", "start_time must be before end_time");
        }
        EventStatus initialStatus = WireCodes.parseNullable(EventStatus.class, request.status(), "status");
        String branchCode = request.branchCode().trim();
        if (!referenceValidator.exists(ReferenceKind.BRANCH, branchCode)) {
            throw ProblemException.validation("UNKNOWN_BRANCH", "branch_code " + branchCode + " does not exist");
        }
        List<UUID> resourceIds = resolveResources(request.resources());

        ProgramRequest programRequest = null;
        UUID requestId = Identifiers.resolveOrNotFound(
                request.requestId(), ProgramRequestService.REQUEST_NOT_FOUND, "program request");
        if (requestId != null) {
            programRequest = programRequestRepository.findById(requestId)
                    .orElseThrow(() -> ProblemException.notFound(
                            ProgramRequestService.REQUEST_NOT_FOUND, "program request " + requestId + " does not exist"));
            if (programRequest.getStatus() != ProgramRequestStatus.APPROVED) {
                throw new ProblemException(HttpStatus.PRECONDITION_FAILED, REQUEST_NOT_APPROVED,
                        "program request " + requestId + " is " + WireCodes.code(programRequest.getStatus()));
            }
        }

        ProgramEvent event = new ProgramEvent();
        event.setProgramRequest(programRequest);
        event.setTitle(request.title().trim());
        event.setBranchCode(branchCode);
        event.reschedule(request.startTime(), request.endTime());
        event.setLocation(trimToNull(request.location()));
        event.setResourceIds(resourceIds);
        if (initialStatus != null) {
            event.setInitialStatus(initialStatus);
        }

        ProgramEvent saved = programEventRepository.save(event);
        log.info("Event {} scheduled for branch {} (request {})", saved.getId(), branchCode, requestId);
        return saved;
    }

    @Transactional(readOnly = true)
    public List<EventResponse> listEvents(String branchCode, String status, String requestId) {
        EventStatus statusFilter = WireCodes.parseNullable(EventStatus.class, status, "status");
        UUID requestFilter = null;
        if (requestId != null && !requestId.isBlank()) {
            Optional<UUID> parsed = Identifiers.tryParse(requestId);
            if (parsed.isEmpty()) {
                return List.of();
            }
            requestFilter = parsed.get();
        }
        String branchFilter = branchCode != null && !branchCode.isBlank() ? branchCode.trim() : null;
        EventSearchCondition condition = new EventSearchCondition(branchFilter, statusFilter, requestFilter);
        return programEventRepository.search(condition).stream()
                .map(this::toResponse)
                .toList();
    }

    @Transactional(readOnly = true)
    public EventResponse getEvent(UUID eventId) {
        return programEventRepository.findById(eventId)
                .map(this::toResponse)
                .orElseThrow(() -> notFound(eventId));
    }

    public EventResponse updateStatus(UUID eventId, String rawStatus) {
        EventStatus target = WireCodes.parse(EventStatus.class, rawStatus, "status");
        ProgramEvent event = programEventRepository.findByIdForUpdate(eventId)
                .orElseThrow(() -> notFound(eventId));
        EventStatus current = event.getStatus();
        if (!current.canTransitionTo(target)) {
            throw ProblemException.conflict(INVALID_EVENT_TRANSITION,
                    "event is " + WireCodes.code(current) + " and cannot become " + WireCodes.code(target));
        }
        event.transitionTo(target);
        ProgramEvent saved = programEventRepository.saveAndFlush(event);
        log.info("Event {} moved from {} to {}", eventId, current, target);
        return toResponse(saved);
    }

    public static ProblemException notFound(Object eventId) {
        return ProblemException.notFound(EVENT_NOT_FOUND, "event " + eventId + " does not exist");
    }

    EventResponse toResponse(ProgramEvent event) {
        return new EventResponse(
                event.getId(),
                event.getRequestId(),
                event.getTitle(),
                event.getBranchCode(),
                event.getStartTime(),
                event.getEndTime(),
                event.getLocation(),
                event.getResourceIds(),
                WireCodes.code(event.getStatus()),
                event.getCreatedAt(),
                event.getUpdatedAt()
        );
    }

    private List<UUID> resolveResources(List<String> resources) {
        Set<UUID> resolved = new LinkedHashSet<>();
        for (int i = 0; i < resources.size(); i++) {
            String raw = resources.get(i);
            UUID resourceId = parseResource(raw, i);
            if (!referenceValidator.exists(ReferenceKind.RESOURCE, resourceId.toString())) {
                throw unknownResource(raw, i);
            }
            resolved.add(resourceId);
        }
        return new ArrayList<>(resolved);
    }

    private UUID parseResource(String raw, int index) {
        if (raw == null || raw.isBlank()) {
            throw unknownResource(raw, index);
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException ex) {
            throw unknownResource(raw, index);
        }
    }

    private ProblemException unknownResource(String raw, int index) {
        return ProblemException.validation("UNKNOWN_RESOURCE", "resources[" + index + "] " + raw + " does not exist");
    }

    private String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }
}
