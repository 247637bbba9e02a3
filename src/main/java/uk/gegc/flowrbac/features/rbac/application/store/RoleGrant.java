package uk.gegc.flowrbac.features.rbac.application.store;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.UUID;

/**
 * One granted (role, permission name, scope kind) triple.
 */
public record RoleGrant(UUID roleId, String permissionName, ScopeType scope) {
}
