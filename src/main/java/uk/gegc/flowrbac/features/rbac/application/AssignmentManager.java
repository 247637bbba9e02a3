package uk.gegc.flowrbac.features.rbac.application;

import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionRecord;
import uk.gegc.flowrbac.features.rbac.application.store.RoleRecord;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.List;
import java.util.UUID;

/**
 * Lifecycle of user-role assignments.
 */
public interface AssignmentManager {

    AssignmentRecord assignRole(UUID userId, String roleName, ScopeType scopeType, UUID scopeId, UUID createdBy);

    /**
     * @param createdBy null for system-generated assignments
     * @param immutable an immutable assignment can never be updated or removed through this interface
     */
    AssignmentRecord assignRole(UUID userId, String roleName, ScopeType scopeType, UUID scopeId,
                                UUID createdBy, boolean immutable);

    void removeRole(UUID assignmentId);

    void removeRole(UUID assignmentId, UUID actorId);

    AssignmentRecord updateRole(UUID assignmentId, String newRoleName);

    AssignmentRecord updateRole(UUID assignmentId, String newRoleName, UUID actorId);

    /**
     * @param userId null lists the assignments of every user
     */
    List<AssignmentRecord> listUserAssignments(UUID userId);

    /**
     * Every filter is optional.
     */
    List<AssignmentRecord> listAssignments(UUID userId, String roleName, ScopeType scopeType);

    /**
     * Permissions of the user's effective role at the scope, for the scope's kind. No bypass applies.
     */
    List<PermissionRecord> getUserPermissionsForScope(UUID userId, ScopeType scopeType, UUID scopeId);

    List<RoleRecord> listRoles();

    /**
     * Deletes every assignment on a resource that is itself being deleted, immutable ones included.
     *
     * @return number of assignments deleted
     */
    int removeAssignmentsForScope(ScopeType scopeType, UUID scopeId);
}
