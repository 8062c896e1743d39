package com.unifiedplatform.backend.modules.notification;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.UUID;

import com.unifiedplatform.backend.modules.notification.application.NotificationService;
import com.unifiedplatform.backend.modules.notification.application.ProgramRequestDecisionNotifier;
import com.unifiedplatform.backend.modules.notification.domain.NotificationType;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestDecidedEvent;
import com.unifiedplatform.backend.modules.request.domain.ApprovalDecision;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ProgramRequestDecisionNotifierTest {

    private static final UUID REQUEST_ID = UUID.fromString("00000000-0000-0000-0000-000000001301");
    private static final UUID APPROVAL_ID = UUID.fromString("00000000-0000-0000-0000-000000001302");

    @Mock
    private NotificationService notificationService;

    private ProgramRequestDecisionNotifier notifier;

    @BeforeEach
    void setUp() {
        notifier = new ProgramRequestDecisionNotifier(notificationService);
    }

    @Test
    void approvalNotifiesBranchAndRequesterWithSuccess() {
        notifier.onDecision(decided(ApprovalDecision.APPROVED, "lead@example.org"));

        verify(notificationService).sendDetached(
                eq("lead@example.org"), eq("RU-01"), eq("Program request approved"),
                contains("Campus clean-up"), eq(NotificationType.SUCCESS));
    }

    @Test
    void rejectionWithNonEmailRequesterNotifiesBranchOnly() {
        notifier.onDecision(decided(ApprovalDecision.REJECTED, "7c4f2a10-0000-0000-0000-000000000000"));

        verify(notificationService).sendDetached(
                isNull(), eq("RU-01"), eq("Program request rejected"),
                contains("rejected"), eq(NotificationType.WARNING));
    }

    @Test
    void notificationFailureDoesNotPropagate() {
        when(notificationService.sendDetached(any(), any(), any(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("store down"));

        assertThatCode(() -> notifier.onDecision(decided(ApprovalDecision.APPROVED, null)))
                .doesNotThrowAnyException();
    }

    private static ProgramRequestDecidedEvent decided(ApprovalDecision decision, String requestedBy) {
        return new ProgramRequestDecidedEvent(REQUEST_ID, APPROVAL_ID, "RU-01", "Campus clean-up", requestedBy,
                decision, "reviewer@example.org", null);
    }
}
