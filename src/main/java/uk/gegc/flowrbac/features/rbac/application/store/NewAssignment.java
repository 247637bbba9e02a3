package uk.gegc.flowrbac.features.rbac.application.store;

import java.time.Instant;
import java.util.UUID;

public record NewAssignment(
        UUID userId,
        UUID roleId,
        ScopeRef scope,
        boolean immutable,
        Instant createdAt,
        UUID createdBy
) {
}
