package uk.gegc.flowrbac.features.project.api.dto;

import java.time.Instant;
import java.util.UUID;

public record ProjectDto(
        UUID id,
        String name,
        UUID userId,
        boolean starterProject,
        Instant createdAt
) {}
