package uk.gegc.flowrbac.features.rbac.application;

import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.InvalidScopeException;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.util.Identifiers;

import java.util.UUID;

/**
 * One question put to the checkers: may the user perform {@code permissionName} on this scope?
 * <p>
 * Construction fails fast on malformed input so that a caller bug never reads as a denial.
 */
public record PermissionCheck(String permissionName, ScopeType scopeType, UUID scopeId) {

    public PermissionCheck {
        if (permissionName == null || permissionName.isBlank()) {
            throw new ValidationException("permission name is required");
        }
        if (scopeType == null) {
            throw new InvalidScopeException("scope_type is required");
        }
        if (scopeType.requiresScopeId() && scopeId == null) {
            throw new InvalidScopeException(scopeType.getValue() + " scope requires a scope_id");
        }
        if (!scopeType.requiresScopeId() && scopeId != null) {
            throw new InvalidScopeException("Global scope must not have a scope_id");
        }
    }

    public static PermissionCheck of(String permissionName, ScopeType scopeType, UUID scopeId) {
        return new PermissionCheck(permissionName, scopeType, scopeId);
    }

    /**
     * Parses a check whose scope and id arrive as text.
     */
    public static PermissionCheck parse(String permissionName, String scopeType, String scopeId) {
        return new PermissionCheck(permissionName,
                ScopeType.fromValue(scopeType),
                Identifiers.parseOptional(scopeId, "scope_id"));
    }

    public ScopeRef scope() {
        return ScopeRef.of(scopeType, scopeId);
    }
}
