package com.unifiedplatform.backend.modules.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import com.unifiedplatform.backend.modules.request.domain.ApprovalDecision;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class ProgramRequestStatusTest {

    @Test
    void submittedMayGoToReviewOrStraightToDecision() {
        assertThat(ProgramRequestStatus.SUBMITTED.allowedSuccessors())
                .containsExactlyInAnyOrder(
                        ProgramRequestStatus.UNDER_REVIEW,
                        ProgramRequestStatus.APPROVED,
                        ProgramRequestStatus.REJECTED);
        assertThat(ProgramRequestStatus.UNDER_REVIEW.allowedSuccessors())
                .containsExactlyInAnyOrder(ProgramRequestStatus.APPROVED, ProgramRequestStatus.REJECTED);
    }

    @ParameterizedTest
    @EnumSource(value = ProgramRequestStatus.class, names = {"APPROVED", "REJECTED"})
    @DisplayName("decided requests accept no further transition")
    void decisionsAreTerminal(ProgramRequestStatus decided) {
        assertThat(decided.isTerminal()).isTrue();
        for (ProgramRequestStatus next : ProgramRequestStatus.values()) {
            assertThat(decided.canTransitionTo(next)).isFalse();
        }
    }

    @Test
    void reviewCannotGoBackToSubmitted() {
        assertThat(ProgramRequestStatus.UNDER_REVIEW.canTransitionTo(ProgramRequestStatus.SUBMITTED)).isFalse();
        assertThat(ProgramRequestStatus.SUBMITTED.canTransitionTo(ProgramRequestStatus.SUBMITTED)).isFalse();
        assertThat(ProgramRequestStatus.SUBMITTED.canTransitionTo(null)).isFalse();
    }

    @Test
    void decisionMapsToMatchingStatus() {
        assertThat(ApprovalDecision.APPROVED.targetStatus()).isEqualTo(ProgramRequestStatus.APPROVED);
        assertThat(ApprovalDecision.REJECTED.targetStatus()).isEqualTo(ProgramRequestStatus.REJECTED);
    }

    @Test
    void entityRefusesIllegalMove() {
        ProgramRequest request = new ProgramRequest();
        request.transitionTo(ProgramRequestStatus.REJECTED);

        assertThatThrownBy(() -> request.transitionTo(ProgramRequestStatus.APPROVED))
                .isInstanceOf(IllegalStateException.class);
        assertThat(request.getStatus()).isEqualTo(ProgramRequestStatus.REJECTED);
    }

    @Test
    void budgetItemRejectsNegativeAmount() {
        ProgramRequest request = new ProgramRequest();
        request.addBudgetItem("venue", BigDecimal.ZERO);

        assertThatThrownBy(() -> request.addBudgetItem("catering", new BigDecimal("-0.01")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(request.getBudget()).hasSize(1);
    }
}
