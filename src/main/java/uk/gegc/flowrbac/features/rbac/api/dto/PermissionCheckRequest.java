package uk.gegc.flowrbac.features.rbac.api.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.List;

public record PermissionCheckRequest(
        @NotNull(message = "Checks are required")
        @Size(min = 1, max = 100, message = "Between 1 and 100 checks are allowed per request")
        List<@Valid @NotNull PermissionCheckItem> checks
) {}
