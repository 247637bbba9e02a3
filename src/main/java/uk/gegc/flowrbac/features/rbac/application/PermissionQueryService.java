package uk.gegc.flowrbac.features.rbac.application;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import uk.gegc.flowrbac.features.rbac.api.dto.PermissionCheckRequest;
import uk.gegc.flowrbac.features.rbac.api.dto.PermissionCheckResult;

import java.util.List;

/**
 * Boundary for batch checks arriving as raw request data.
 */
public interface PermissionQueryService {

    /**
     * Requests outside the allowed size are rejected before any resolution query runs.
     *
     * @return one result per requested check, in request order
     */
    List<PermissionCheckResult> checkPermissions(@NotNull String userId, @NotNull @Valid PermissionCheckRequest request);
}
