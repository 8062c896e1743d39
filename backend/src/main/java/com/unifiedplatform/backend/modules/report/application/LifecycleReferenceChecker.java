package com.unifiedplatform.backend.modules.report.application;

import java.util.UUID;

import com.unifiedplatform.backend.global.common.Identifiers;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.event.application.EventService;
import com.unifiedplatform.backend.modules.event.domain.ProgramEvent;
import com.unifiedplatform.backend.modules.event.infrastructure.persistence.ProgramEventRepository;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestService;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Validates the optional request/event pair carried by post-event facts.
 *
 * <p>Each supplied id must exist. When both are supplied and the event was scheduled from a request, that
 * request must be the one supplied.
 */
@Component
public class LifecycleReferenceChecker {

    public static final String INCONSISTENT_REFERENCE = "INCONSISTENT_REFERENCE";

    private static final Logger log = LoggerFactory.getLogger(LifecycleReferenceChecker.class);

    private final ProgramRequestRepository programRequestRepository;
    private final ProgramEventRepository programEventRepository;

    public LifecycleReferenceChecker(
            ProgramRequestRepository programRequestRepository,
            ProgramEventRepository programEventRepository
    ) {
        this.programRequestRepository = programRequestRepository;
        this.programEventRepository = programEventRepository;
    }

    public LifecycleReferences check(String rawRequestId, String rawEventId) {
        UUID requestId = Identifiers.resolveOrNotFound(
                rawRequestId, ProgramRequestService.REQUEST_NOT_FOUND, "program request");
        UUID eventId = Identifiers.resolveOrNotFound(rawEventId, EventService.EVENT_NOT_FOUND, "event");

        if (requestId != null && !programRequestRepository.existsById(requestId)) {
            throw ProblemException.notFound(
                    ProgramRequestService.REQUEST_NOT_FOUND, "program request " + requestId + " does not exist");
        }
        if (eventId == null) {
            return new LifecycleReferences(requestId, null);
        }
        ProgramEvent event = programEventRepository.findById(eventId)
                .orElseThrow(() -> EventService.notFound(eventId));
        UUID eventRequestId = event.getRequestId();
        if (requestId != null && eventRequestId != null && !eventRequestId.equals(requestId)) {
            log.debug("Event {} belongs to request {}, not {}", eventId, eventRequestId, requestId);
            throw ProblemException.conflict(INCONSISTENT_REFERENCE,
                    "event " + eventId + " was scheduled for request " + eventRequestId + ", not " + requestId);
        }
        return new LifecycleReferences(requestId, eventId);
    }
}
