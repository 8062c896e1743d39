package com.unifiedplatform.backend.modules.request.domain;

import java.util.UUID;

import com.unifiedplatform.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

/**
 * Append-only record of a decision taken on a program request.
 */
@Entity
@Immutable
@Table(name = "approval")
public class Approval extends AbstractCreatedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "request_id", nullable = false, updatable = false)
    private ProgramRequest programRequest;

    @Column(name = "approved_by", nullable = false, length = 255, updatable = false)
    private String approvedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "decision", nullable = false, length = 16, updatable = false)
    private ApprovalDecision decision;

    @Column(name = "notes", updatable = false)
    private String notes;

    protected Approval() {
    }

    public Approval(ProgramRequest programRequest, String approvedBy, ApprovalDecision decision, String notes) {
        this.programRequest = programRequest;
        this.approvedBy = approvedBy;
        this.decision = decision;
        this.notes = notes;
    }

    public UUID getId() {
        return id;
    }

    public ProgramRequest getProgramRequest() {
        return programRequest;
    }

    public String getApprovedBy() {
        return approvedBy;
    }

    public ApprovalDecision getDecision() {
        return decision;
    }

    public String getNotes() {
        return notes;
    }
}
