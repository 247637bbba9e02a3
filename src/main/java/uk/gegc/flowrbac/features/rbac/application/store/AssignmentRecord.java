package uk.gegc.flowrbac.features.rbac.application.store;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.time.Instant;
import java.util.UUID;

/**
 * A user-role assignment with its role loaded.
 *
 * @param createdBy null when the assignment was generated by the system
 */
public record AssignmentRecord(
        UUID id,
        UUID userId,
        RoleRecord role,
        ScopeType scopeType,
        UUID scopeId,
        boolean immutable,
        Instant createdAt,
        UUID createdBy
) {

    public UUID roleId() {
        return role.id();
    }

    public ScopeRef scope() {
        return ScopeRef.of(scopeType, scopeId);
    }
}
