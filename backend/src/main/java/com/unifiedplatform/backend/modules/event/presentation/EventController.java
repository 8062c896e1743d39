package com.unifiedplatform.backend.modules.event.presentation;

import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.common.WireCodes;
import com.unifiedplatform.backend.global.web.CreatedResponse;
import com.unifiedplatform.backend.modules.event.application.EventService;
import com.unifiedplatform.backend.modules.event.domain.ProgramEvent;
import com.unifiedplatform.backend.modules.event.presentation.dto.EventResponse;
import com.unifiedplatform.backend.modules.event.presentation.dto.ScheduleEventRequest;
import com.unifiedplatform.backend.modules.event.presentation.dto.UpdateEventStatusRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import jakarta.validation.Valid;

import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/events")
public class EventController {

    private final EventService eventService;

    public EventController(EventService eventService) {
        this.eventService = eventService;
    }

    @Operation(summary = "Schedule an event", description = "A linked program request must already be approved.")
    @PostMapping
    public ResponseEntity<CreatedResponse> scheduleEvent(@Valid @RequestBody ScheduleEventRequest request) {
        ProgramEvent saved = eventService.schedule(request);
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(CreatedResponse.withStatus(saved.getId(), WireCodes.code(saved.getStatus())));
    }

    @GetMapping
    public ResponseEntity<List<EventResponse>> listEvents(
            @RequestParam(name = "branch_code", required = false) String branchCode,
            @Parameter(description = "scheduled, in_progress, completed or cancelled")
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "request_id", required = false) String requestId
    ) {
        return ResponseEntity.ok(eventService.listEvents(branchCode, status, requestId));
    }

    @GetMapping("/{eventId}")
    public ResponseEntity<EventResponse> getEvent(@PathVariable("eventId") UUID eventId) {
        return ResponseEntity.ok(eventService.getEvent(eventId));
    }

    @Operation(summary = "Move an event along its lifecycle")
    @PatchMapping("/{eventId}/status")
    public ResponseEntity<EventResponse> updateStatus(
            @PathVariable("eventId") UUID eventId,
            @Valid @RequestBody UpdateEventStatusRequest request
    ) {
        return ResponseEntity.ok(eventService.updateStatus(eventId, request.status()));
    }
}
