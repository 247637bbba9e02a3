package uk.gegc.flowrbac.features.rbac.application.store;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.DuplicateAssignmentException;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistence boundary of the access-control core.
 * <p>
 * Results are plain values so the resolution logic never holds on to a persistence
 * session. Implementations apply no business rules: missing rows surface as empty
 * results and unique-key collisions as {@link DuplicateAssignmentException}.
 * Lists of assignments are returned in precedence order (oldest first, then by id).
 */
public interface PermissionStore {

    // ==================== Users ====================

    Optional<UserRecord> findUser(UUID userId);

    // ==================== Roles and permissions ====================

    Optional<RoleRecord> findRoleByName(String name);

    List<RoleRecord> findAllRoles();

    boolean roleHasPermission(UUID roleId, String permissionName, ScopeType scope);

    List<PermissionRecord> findRolePermissions(UUID roleId, ScopeType scope);

    /**
     * All grants held by the given roles, in a single round trip.
     */
    List<RoleGrant> findGrants(Collection<UUID> roleIds);

    // ==================== Assignments ====================

    boolean hasGlobalRole(UUID userId, String roleName);

    /**
     * The highest-precedence direct assignment of the user at exactly this scope.
     */
    Optional<AssignmentRecord> findDirectAssignment(UUID userId, ScopeRef scope);

    /**
     * Direct assignments of the user at any of the given scopes, in a single round trip.
     */
    List<AssignmentRecord> findAssignmentsAtScopes(UUID userId, Collection<ScopeRef> scopes);

    Optional<AssignmentRecord> findAssignment(UUID userId, UUID roleId, ScopeRef scope);

    Optional<AssignmentRecord> findAssignmentById(UUID assignmentId);

    /**
     * @param userId null lists every assignment
     */
    List<AssignmentRecord> findAssignments(UUID userId);

    AssignmentRecord insertAssignment(NewAssignment assignment);

    AssignmentRecord updateAssignmentRole(UUID assignmentId, UUID roleId);

    void deleteAssignment(UUID assignmentId);

    int deleteAssignmentsAtScope(ScopeRef scope);

    // ==================== Resources ====================

    boolean projectExists(UUID projectId);

    boolean flowExists(UUID flowId);

    Optional<UUID> findFlowParentProjectId(UUID flowId);

    /**
     * Parent project ids keyed by flow id, in a single round trip. Standalone flows are absent.
     */
    Map<UUID, UUID> findFlowParentProjectIds(Collection<UUID> flowIds);

    default boolean resourceExists(ScopeType scopeType, UUID scopeId) {
        return switch (scopeType) {
            case PROJECT -> projectExists(scopeId);
            case FLOW -> flowExists(scopeId);
            case GLOBAL -> scopeId == null;
        };
    }
}
