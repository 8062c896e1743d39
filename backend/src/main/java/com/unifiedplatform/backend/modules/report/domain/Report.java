package com.unifiedplatform.backend.modules.report.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * Post-event summary. Photos are stored as opaque URLs or storage keys.
 */
@Entity
@Immutable
@Table(name = "report")
public class Report extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "request_id", updatable = false, columnDefinition = "uuid")
    private UUID requestId;

    @Column(name = "event_id", updatable = false, columnDefinition = "uuid")
    private UUID eventId;

    @Column(name = "submitted_by", updatable = false, length = 255)
    private String submittedBy;

    @Column(name = "summary", nullable = false, updatable = false)
    private String summary;

    @Column(name = "attendees_count", updatable = false)
    private Integer attendeesCount;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "report_photo", joinColumns = @JoinColumn(name = "report_id"))
    @Column(name = "photo_ref", nullable = false, length = 1024)
    @OrderColumn(name = "position")
    private List<String> photos = new ArrayList<>();

    protected Report() {
    }

    public Report(UUID requestId, UUID eventId, String submittedBy, String summary, Integer attendeesCount,
                  List<String> photos) {
        if (attendeesCount != null && attendeesCount < 0) {
            throw new IllegalArgumentException("attendees_count must be >= 0");
        }
        this.requestId = requestId;
        this.eventId = eventId;
        this.submittedBy = submittedBy;
        this.summary = summary;
        this.attendeesCount = attendeesCount;
        this.photos = new ArrayList<>(photos);
    }

    public UUID getId() {
        return id;
    }

    public UUID getRequestId() {
        return requestId;
    }

    public UUID getEventId() {
        return eventId;
    }

    public String getSubmittedBy() {
        return submittedBy;
    }

    public String getSummary() {
        return summary;
    }

    public Integer getAttendeesCount() {
        return attendeesCount;
    }

    public List<String> getPhotos() {
        return List.copyOf(photos);
    }
}
