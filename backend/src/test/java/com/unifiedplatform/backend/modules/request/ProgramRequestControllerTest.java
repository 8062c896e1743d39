package com.unifiedplatform.backend.modules.request;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.UUID;

import com.unifiedplatform.backend.global.error.ProblemException;
import com.unifiedplatform.backend.modules.request.application.ApprovalService;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestService;
import com.unifiedplatform.backend.modules.request.domain.ProgramRequest;
import com.unifiedplatform.backend.modules.request.presentation.ApprovalController;
import com.unifiedplatform.backend.modules.request.presentation.ProgramRequestController;
import com.unifiedplatform.backend.modules.request.presentation.dto.RecordApprovalRequest;
import com.unifiedplatform.backend.modules.request.presentation.dto.SubmitProgramRequest;
import com.unifiedplatform.backend.support.TestEntities;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.CannotAcquireLockException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = {ProgramRequestController.class, ApprovalController.class})
class ProgramRequestControllerTest {

    private static final UUID REQUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000000401");

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private ProgramRequestService programRequestService;

    @MockBean
    private ApprovalService approvalService;

    @Test
    @DisplayName("a client-supplied status is ignored and the request comes back submitted")
    void submitIgnoresClientStatus() throws Exception {
        given(programRequestService.submit(any(SubmitProgramRequest.class)))
                .willReturn(TestEntities.withId(new ProgramRequest(), REQUEST_ID));

        mockMvc.perform(post("/program-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "branch_code": "RU-01",
                                  "program_title": "Campus clean-up",
                                  "program_type": "student_activity",
                                  "budget": [{"name": "venue", "amount": 100}],
                                  "status": "approved"
                                }
                                """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").value(REQUEST_ID.toString()))
                .andExpect(jsonPath("$.status").value("submitted"));
    }

    @Test
    void submitWithoutTitleIsUnprocessable() throws Exception {
        mockMvc.perform(post("/program-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"branch_code": "RU-01", "program_type": "student_activity"}
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.detail").value(containsString("PROGRAM_TITLE_REQUIRED")));
        verifyNoInteractions(programRequestService);
    }

    @Test
    void malformedJsonIsBadRequest() throws Exception {
        mockMvc.perform(post("/program-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"branch_code\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MALFORMED_BODY"));
    }

    @Test
    @DisplayName("a null budget entry is a validation error naming its position, not an unreadable body")
    void nullBudgetEntryIsUnprocessable() throws Exception {
        mockMvc.perform(post("/program-requests")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {
                                  "branch_code": "RU-01",
                                  "program_title": "Campus clean-up",
                                  "program_type": "student_activity",
                                  "budget": [{"name": "venue", "amount": 100}, null]
                                }
                                """))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("validation_error"))
                .andExpect(jsonPath("$.detail").value(containsString("budget[1]")))
                .andExpect(jsonPath("$.detail").value(containsString("BUDGET_ITEM_REQUIRED")));
        verifyNoInteractions(programRequestService);
    }

    @Test
    void unknownStatusFilterIsUnprocessable() throws Exception {
        mockMvc.perform(get("/program-requests").param("status", "pending"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.code").value("INVALID_STATUS"));
    }

    @Test
    void missingRequestIsNotFound() throws Exception {
        given(programRequestService.getRequest(REQUEST_ID))
                .willThrow(ProblemException.notFound("REQUEST_NOT_FOUND", "program request does not exist"));

        mockMvc.perform(get("/program-requests/{id}", REQUEST_ID))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("REQUEST_NOT_FOUND"))
                .andExpect(jsonPath("$.instance").value("/program-requests/" + REQUEST_ID));
    }

    @Test
    @DisplayName("a lock wait that runs out surfaces as a retryable store outage")
    void lockTimeoutIsServiceUnavailable() throws Exception {
        given(approvalService.recordApproval(any(RecordApprovalRequest.class)))
                .willThrow(new CannotAcquireLockException("lock timeout"));

        mockMvc.perform(post("/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request_id": "%s", "approved_by": "reviewer@example.org", "decision": "approved"}
                                """.formatted(REQUEST_ID)))
                .andExpect(status().isServiceUnavailable())
                .andExpect(header().string(HttpHeaders.RETRY_AFTER, "5"))
                .andExpect(jsonPath("$.code").value("STORE_UNAVAILABLE"));
    }

    @Test
    void invalidTransitionIsConflict() throws Exception {
        given(approvalService.recordApproval(any(RecordApprovalRequest.class)))
                .willThrow(ProblemException.conflict("INVALID_TRANSITION", "request is approved"));

        mockMvc.perform(post("/approvals")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"request_id": "%s", "approved_by": "reviewer@example.org", "decision": "rejected"}
                                """.formatted(REQUEST_ID)))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("INVALID_TRANSITION"));
    }
}
