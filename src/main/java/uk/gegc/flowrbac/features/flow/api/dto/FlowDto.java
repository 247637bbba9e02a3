package uk.gegc.flowrbac.features.flow.api.dto;

import java.time.Instant;
import java.util.UUID;

/**
 * @param projectId null for a standalone flow
 */
public record FlowDto(
        UUID id,
        String name,
        UUID userId,
        UUID projectId,
        Instant createdAt
) {}
