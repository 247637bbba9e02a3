package uk.gegc.flowrbac.features.rbac.application;

import uk.gegc.flowrbac.features.rbac.domain.event.RoleAssignmentChangedEvent;
import uk.gegc.flowrbac.features.rbac.domain.model.RoleAssignmentAudit;

import java.util.List;
import java.util.UUID;

public interface RoleAssignmentAuditService {

    /**
     * Persists one audit row for the change. Sink failures are logged and never rethrown.
     */
    void record(RoleAssignmentChangedEvent event);

    List<RoleAssignmentAudit> getAssignmentHistory(UUID assignmentId);

    List<RoleAssignmentAudit> getUserHistory(UUID userId);
}
