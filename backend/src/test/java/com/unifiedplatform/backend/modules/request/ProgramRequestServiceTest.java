package com.unifiedplatform.backend.modules.request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import com.unifiedplatform.backend.global.config.PlatformProperties;
import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.reference.application.ReferenceValidator;
import com.unifiedplatform.backend.modules.reference.domain.ReferenceKind;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestService;
import com.unifiedplatform.backend.modules.request.domain.BudgetItem;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequestStatus;
import com.unifiedplatform.backend.modules.request.domain.ProgramType;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestRepository;
import com.unifiedplatform.backend.modules.request.infrastructure.persistence.ProgramRequestSearchCondition;
import com.unifiedplatform.backend.modules.request.presentation.dto.BudgetItemInput;
import com.unifiedplatform.backend.modules.request.presentation.dto.ProgramRequestResponse;
import com.unifiedplatform.backend.modules.request.presentation.dto.SubmitProgramRequest;
import com.unifiedplatform.backend.support.TestEntities;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

@ExtendWith(MockitoExtension.class)
class ProgramRequestServiceTest {

    private static final UUID REQUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000000101");

    @Mock
    private ProgramRequestRepository programRequestRepository;

    @Mock
    private ReferenceValidator referenceValidator;

    private ProgramRequestService programRequestService;

    @BeforeEach
    void setUp() {
        PlatformProperties properties = new PlatformProperties(
                new PlatformProperties.Cors(List.of("*")),
                new PlatformProperties.Store(Duration.ofSeconds(5), 5));
        programRequestService = new ProgramRequestService(programRequestRepository, referenceValidator, properties);
    }

    @Test
    @DisplayName("a new request is always stored as submitted with its budget in order")
    void submitStoresSubmittedRequest() {
        when(referenceValidator.exists(ReferenceKind.BRANCH, "RU-01")).thenReturn(true);
        when(programRequestRepository.save(any(ProgramRequest.class)))
                .thenAnswer(invocation -> TestEntities.withId(invocation.getArgument(0), REQUEST_ID));

        ProgramRequest saved = programRequestService.submit(submission("student_activity",
                List.of(new BudgetItemInput("venue", new BigDecimal("100")),
                        new BudgetItemInput("snacks", new BigDecimal("25.50"))),
                null));

        ArgumentCaptor<ProgramRequest> captor = ArgumentCaptor.forClass(ProgramRequest.class);
        verify(programRequestRepository).save(captor.capture());
        ProgramRequest stored = captor.getValue();
        assertThat(saved.getId()).isEqualTo(REQUEST_ID);
        assertThat(stored.getStatus()).isEqualTo(ProgramRequestStatus.SUBMITTED);
        assertThat(stored.getProgramType()).isEqualTo(ProgramType.STUDENT_ACTIVITY);
        assertThat(stored.getBranchCode()).isEqualTo("RU-01");
        assertThat(stored.getBudget()).extracting(BudgetItem::getName).containsExactly("venue", "snacks");
    }

    @Test
    void submitRejectsUnknownProgramTypeBeforeTouchingTheStore() {
        assertThatThrownBy(() -> programRequestService.submit(submission("hackathon", List.of(), null)))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
                    assertThat(ex.getCode()).isEqualTo("INVALID_PROGRAM_TYPE");
                });
        verifyNoInteractions(referenceValidator, programRequestRepository);
    }

    @Test
    void submitRejectsNegativeBudgetAmount() {
        SubmitProgramRequest request = submission("volunteering",
                List.of(new BudgetItemInput("venue", new BigDecimal("-1"))), null);

        assertThatThrownBy(() -> programRequestService.submit(request))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("NEGATIVE_BUDGET_AMOUNT"));
        verify(programRequestRepository, never()).save(any());
    }

    @Test
    void submitRejectsUnknownBranch() {
        when(referenceValidator.exists(ReferenceKind.BRANCH, "RU-01")).thenReturn(false);

        assertThatThrownBy(() -> programRequestService.submit(submission("volunteering", List.of(), null)))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("UNKNOWN_BRANCH"));
        verify(programRequestRepository, never()).save(any());
    }

    @Test
    void submitChecksRequesterWhenPresent() {
        when(referenceValidator.exists(ReferenceKind.BRANCH, "RU-01")).thenReturn(true);
        when(referenceValidator.exists(ReferenceKind.USER, "ghost@example.org")).thenReturn(false);

        assertThatThrownBy(() -> programRequestService.submit(
                submission("volunteering", List.of(), "ghost@example.org")))
                .isInstanceOfSatisfying(ProblemException.class,
                        ex -> assertThat(ex.getCode()).isEqualTo("UNKNOWN_USER"));
    }

    @Test
    void getRequestReportsMissingRequest() {
        when(programRequestRepository.findById(REQUEST_ID)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> programRequestService.getRequest(REQUEST_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
                    assertThat(ex.getCode()).isEqualTo(ProgramRequestService.REQUEST_NOT_FOUND);
                });
    }

    @Test
    void listRequestsPassesFiltersAndRendersWireCodes() {
        ProgramRequest stored = TestEntities.withId(storedRequest(ProgramRequestStatus.UNDER_REVIEW), REQUEST_ID);
        ProgramRequestSearchCondition condition =
                new ProgramRequestSearchCondition(ProgramRequestStatus.UNDER_REVIEW, "RU-01");
        when(programRequestRepository.search(condition)).thenReturn(List.of(stored));

        List<ProgramRequestResponse> result = programRequestService.listRequests(condition);

        assertThat(result).singleElement().satisfies(response -> {
            assertThat(response.id()).isEqualTo(REQUEST_ID);
            assertThat(response.status()).isEqualTo("under_review");
            assertThat(response.programType()).isEqualTo("community_service");
        });
    }

    @Test
    void startReviewMovesSubmittedRequest() {
        ProgramRequest stored = TestEntities.withId(storedRequest(ProgramRequestStatus.SUBMITTED), REQUEST_ID);
        when(programRequestRepository.lockForDecision(eq(REQUEST_ID), any(Duration.class)))
                .thenReturn(Optional.of(stored));
        when(programRequestRepository.saveAndFlush(stored)).thenReturn(stored);

        ProgramRequestResponse response = programRequestService.startReview(REQUEST_ID);

        assertThat(response.status()).isEqualTo("under_review");
    }

    @Test
    @DisplayName("a decided request cannot be put back under review")
    void startReviewRefusesDecidedRequest() {
        ProgramRequest stored = TestEntities.withId(storedRequest(ProgramRequestStatus.APPROVED), REQUEST_ID);
        when(programRequestRepository.lockForDecision(eq(REQUEST_ID), any(Duration.class)))
                .thenReturn(Optional.of(stored));

        assertThatThrownBy(() -> programRequestService.startReview(REQUEST_ID))
                .isInstanceOfSatisfying(ProblemException.class, ex -> {
                    assertThat(ex.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
                    assertThat(ex.getCode()).isEqualTo(ProgramRequestService.INVALID_TRANSITION);
                });
        verify(programRequestRepository, never()).saveAndFlush(any());
    }

    private static SubmitProgramRequest submission(String type, List<BudgetItemInput> budget, String requestedBy) {
        return new SubmitProgramRequest("RU-01", "Spring clean-up", type, null, null, null, budget, requestedBy);
    }

    private static ProgramRequest storedRequest(ProgramRequestStatus status) {
        ProgramRequest request = new ProgramRequest();
        request.setBranchCode("RU-01");
        request.setProgramTitle("River clean-up");
        request.setProgramType(ProgramType.COMMUNITY_SERVICE);
        if (status != ProgramRequestStatus.SUBMITTED) {
            request.transitionTo(status);
        }
        return request;
    }
}
