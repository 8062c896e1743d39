package com.unifiedplatform.backend.modules.notification.application;

import com.unifiedplatform.backend.modules.notification.domain.NotificationType;
import com.unifiedplatform.backend.modules.request.application.ProgramRequestDecidedEvent;
import com.unifiedplatform.backend.modules.request.domain.ApprovalDecision;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * Tells the branch (and the requester, when known by email) about a committed approval decision.
 * Runs after the decision has committed; a failure here is logged and leaves the decision untouched.
 */
@Component
public class ProgramRequestDecisionNotifier {

    private static final Logger log = LoggerFactory.getLogger(ProgramRequestDecisionNotifier.class);

    private final NotificationService notificationService;

    public ProgramRequestDecisionNotifier(NotificationService notificationService) {
        this.notificationService = notificationService;
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onDecision(ProgramRequestDecidedEvent event) {
        boolean approved = event.decision() == ApprovalDecision.APPROVED;
        NotificationType type = approved ? NotificationType.SUCCESS : NotificationType.WARNING;
        String title = "Program request " + (approved ? "approved" : "rejected");
        String message = messageFor(event, approved);
        try {
            notificationService.sendDetached(
                    requesterEmail(event.requestedBy()), event.branchCode(), title, message, type);
        } catch (RuntimeException ex) {
            log.warn("Could not notify branch {} about decision on request {}",
                    event.branchCode(), event.requestId(), ex);
        }
    }

    static String requesterEmail(String requestedBy) {
        return requestedBy != null && requestedBy.contains("@") ? requestedBy : null;
    }

    private static String messageFor(ProgramRequestDecidedEvent event, boolean approved) {
        StringBuilder sb = new StringBuilder()
                .append('"').append(event.programTitle()).append("\" was ")
                .append(approved ? "approved" : "rejected")
                .append(" by ").append(event.approvedBy()).append('.');
        if (event.notes() != null) {
            sb.append(" Notes: ").append(event.notes());
        }
        return sb.toString();
    }
}
