package uk.gegc.flowrbac.features.rbac.application.store;

import java.util.UUID;

public record UserRecord(UUID id, String username, boolean superuser) {
}
