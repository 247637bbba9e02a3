package uk.gegc.flowrbac.features.rbac.application.store;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.domain.model.UserRoleAssignment;

import java.util.Objects;
import java.util.UUID;

/**
 * A scope kind plus the concrete resource id; the id is null for {@link ScopeType#GLOBAL}.
 */
public record ScopeRef(ScopeType type, UUID id) {

    public ScopeRef {
        Objects.requireNonNull(type, "type");
    }

    public static ScopeRef global() {
        return new ScopeRef(ScopeType.GLOBAL, null);
    }

    public static ScopeRef of(ScopeType type, UUID id) {
        return new ScopeRef(type, id);
    }

    public String key() {
        return UserRoleAssignment.scopeKey(type, id);
    }
}
