package uk.gegc.flowrbac.features.rbac.api.dto;

public record PermissionCheckResult(
        String action,
        String resourceType,
        String resourceId,
        boolean allowed
) {}
