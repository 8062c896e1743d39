package com.unifiedplatform.backend.modules.event.domain;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.jpa.AbstractTimestampedEntity;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A scheduled occurrence of a program. {@code programRequest} is null for ad-hoc events.
 */
@Entity
@Table(name = "event")
public class ProgramEvent extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "request_id", updatable = false)
    private ProgramRequest programRequest;

    @Column(name = "title", nullable = false, length = 200)
    private String title;

    @Column(name = "branch_code", nullable = false, length = 32)
    private String branchCode;

    @Column(name = "start_time", nullable = false)
    private OffsetDateTime startTime;

    @Column(name = "end_time", nullable = false)
    private OffsetDateTime endTime;

    @Column(name = "location", length = 200)
    private String location;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "event_resource", joinColumns = @JoinColumn(name = "event_id"))
    @Column(name = "resource_id", nullable = false, columnDefinition = "uuid")
    @OrderColumn(name = "position")
    private List<UUID> resourceIds = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private EventStatus status = EventStatus.SCHEDULED;

    public UUID getId() {
        return id;
    }

    public ProgramRequest getProgramRequest() {
        return programRequest;
    }

    public void setProgramRequest(ProgramRequest programRequest) {
        this.programRequest = programRequest;
    }

    /**
     * Identity of the originating request without initialising the lazy association.
     */
    public UUID getRequestId() {
        return programRequest != null ? programRequest.getId() : null;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getBranchCode() {
        return branchCode;
    }

    public void setBranchCode(String branchCode) {
        this.branchCode = branchCode;
    }

    public OffsetDateTime getStartTime() {
        return startTime;
    }

    public OffsetDateTime getEndTime() {
        return endTime;
    }

    public void reschedule(OffsetDateTime startTime, OffsetDateTime endTime) {
        if (startTime == null || endTime == null || !startTime.isBefore(endTime)) {
            throw new IllegalArgumentException("start_time must be before end_time");
        }
        this.startTime = startTime;
        this.endTime = endTime;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<UUID> getResourceIds() {
        return List.copyOf(resourceIds);
    }

    public void setResourceIds(List<UUID> resourceIds) {
        this.resourceIds = new ArrayList<>(resourceIds);
    }

    public EventStatus getStatus() {
        return status;
    }

    public void setInitialStatus(EventStatus status) {
        if (id != null) {
            throw new IllegalStateException("initial status can only be set before the event is stored");
        }
        this.status = status;
    }

    public void transitionTo(EventStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Event " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
