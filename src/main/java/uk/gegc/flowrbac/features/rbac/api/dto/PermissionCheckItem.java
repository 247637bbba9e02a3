package uk.gegc.flowrbac.features.rbac.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * One check in a batch request; {@code resourceId} is omitted for Global checks.
 */
public record PermissionCheckItem(
        @NotBlank(message = "Action is required")
        String action,

        @NotBlank(message = "Resource type is required")
        String resourceType,

        String resourceId
) {}
