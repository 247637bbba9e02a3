package uk.gegc.flowrbac.features.rbac.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import uk.gegc.flowrbac.features.rbac.domain.event.RoleAssignmentChangedEvent;

/**
 * Writes the audit trail once an assignment change has committed.
 * <p>
 * Changes published outside a transaction are audited immediately.
 * </p>
 */
@Component
@RequiredArgsConstructor
public class RoleAssignmentAuditListener {

    private final RoleAssignmentAuditService auditService;

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onRoleAssignmentChanged(RoleAssignmentChangedEvent event) {
        auditService.record(event);
    }
}
