package uk.gegc.flowrbac.features.rbac.application.store;

import java.util.UUID;

public record RoleRecord(UUID id, String name, String description, boolean systemRole) {
}
