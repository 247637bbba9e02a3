package uk.gegc.flowrbac.features.rbac.application.store;

import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.UUID;

public record PermissionRecord(UUID id, String name, ScopeType scope, String description) {
}
