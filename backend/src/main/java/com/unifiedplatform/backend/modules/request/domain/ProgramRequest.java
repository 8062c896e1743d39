package com.unifiedplatform.backend.modules.request.domain;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.unifiedplatform.backend.global.jpa.AbstractTimestampedEntity;

import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;

import org.hibernate.annotations.UuidGenerator;

/**
 * A branch's proposal to run a program. Never deleted; after submission only the status moves, and
 * only along {@link ProgramRequestStatus#allowedSuccessors()}.
 */
@Entity
@Table(name = "program_request")
public class ProgramRequest extends AbstractTimestampedEntity {

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "branch_code", nullable = false, length = 32, updatable = false)
    private String branchCode;

    @Column(name = "program_title", nullable = false, length = 200)
    private String programTitle;

    @Enumerated(EnumType.STRING)
    @Column(name = "program_type", nullable = false, length = 32)
    private ProgramType programType;

    @Column(name = "description")
    private String description;

    @Column(name = "proposed_date")
    private OffsetDateTime proposedDate;

    @Column(name = "location", length = 200)
    private String location;

    @ElementCollection(fetch = FetchType.LAZY)
    @CollectionTable(name = "program_request_budget_item", joinColumns = @JoinColumn(name = "program_request_id"))
    @OrderColumn(name = "position")
    private List<BudgetItem> budget = new ArrayList<>();

    @Column(name = "requested_by", length = 255)
    private String requestedBy;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private ProgramRequestStatus status = ProgramRequestStatus.SUBMITTED;

    public UUID getId() {
        return id;
    }

    public String getBranchCode() {
        return branchCode;
    }

    public void setBranchCode(String branchCode) {
        this.branchCode = branchCode;
    }

    public String getProgramTitle() {
        return programTitle;
    }

    public void setProgramTitle(String programTitle) {
        this.programTitle = programTitle;
    }

    public ProgramType getProgramType() {
        return programType;
    }

    public void setProgramType(ProgramType programType) {
        this.programType = programType;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public OffsetDateTime getProposedDate() {
        return proposedDate;
    }

    public void setProposedDate(OffsetDateTime proposedDate) {
        this.proposedDate = proposedDate;
    }

    public String getLocation() {
        return location;
    }

    public void setLocation(String location) {
        this.location = location;
    }

    public List<BudgetItem> getBudget() {
        return List.copyOf(budget);
    }

    public void addBudgetItem(String name, BigDecimal amount) {
        budget.add(new BudgetItem(name, amount));
    }

    public String getRequestedBy() {
        return requestedBy;
    }

    public void setRequestedBy(String requestedBy) {
        this.requestedBy = requestedBy;
    }

    public ProgramRequestStatus getStatus() {
        return status;
    }

    /**
     * Moves the request to {@code next}. Callers check {@link ProgramRequestStatus#canTransitionTo}
     * first and report a refused move to the client; reaching the exception here is a programming error.
     */
    public void transitionTo(ProgramRequestStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Program request " + id + " cannot move from " + status + " to " + next);
        }
        this.status = next;
    }
}
