package com.unifiedplatform.backend.modules.report.domain;

import java.math.BigDecimal;
import java.util.UUID;

import com.unifiedplatform.backend.global.jpa.AbstractCreatedEntity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.UuidGenerator;

@Entity
@Immutable
@Table(name = "evaluation")
public class Evaluation extends AbstractCreatedEntity {

    public static final BigDecimal MIN_SCORE = BigDecimal.ZERO;
    public static final BigDecimal MAX_SCORE = BigDecimal.valueOf(100);

    @Id
    @UuidGenerator
    @Column(name = "id", nullable = false, updatable = false, columnDefinition = "uuid")
    private UUID id;

    @Column(name = "request_id", updatable = false, columnDefinition = "uuid")
    private UUID requestId;

    @Column(name = "event_id", updatable = false, columnDefinition = "uuid")
    private UUID eventId;

    @Column(name = "score", nullable = false, updatable = false, precision = 5, scale = 2)
    private BigDecimal score;

    @Column(name = "methodology", updatable = false, length = 200)
    private String methodology;

    @Column(name = "comments", updatable = false)
    private String comments;

    protected Evaluation() {
    }

    public Evaluation(UUID requestId, UUID eventId, BigDecimal score, String methodology, String comments) {
        if (score == null || score.compareTo(MIN_SCORE) < 0 || score.compareTo(MAX_SCORE) > 0) {
            throw new IllegalArgumentException("score must be between " + MIN_SCORE + " and " + MAX_SCORE);
        }
        this.requestId = requestId;
        this.eventId = eventId;
        this.score = score;
        this.methodology = methodology;
        this.comments = comments;
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

    public BigDecimal getScore() {
        return score;
    }

    public String getMethodology() {
        return methodology;
    }

    public String getComments() {
        return comments;
    }
}
