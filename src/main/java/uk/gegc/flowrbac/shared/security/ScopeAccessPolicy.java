package uk.gegc.flowrbac.shared.security;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.rbac.application.BypassPolicy;
import uk.gegc.flowrbac.features.rbac.application.PermissionChecker;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.ForbiddenException;

import java.util.UUID;

/**
 * Turns negative access decisions into {@link ForbiddenException}.
 * <p>
 * Callers run these checks before looking the resource up, so a denied caller cannot tell
 * a missing resource from one they may not touch.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ScopeAccessPolicy {

    private static final String DEFAULT_FORBIDDEN_MESSAGE = "Access denied";

    private final PermissionChecker permissionChecker;
    private final BypassPolicy bypassPolicy;

    public void requirePermission(UUID userId, String permission, ScopeType scopeType, UUID scopeId) {
        if (userId == null) {
            throwForbidden("Caller identity is required");
        }
        if (!permissionChecker.canAccess(userId, permission, scopeType, scopeId)) {
            log.warn("Access denied: user {} lacks {} on {} {}", userId, permission, scopeType, scopeId);
            throwForbidden(DEFAULT_FORBIDDEN_MESSAGE);
        }
    }

    public boolean isAdmin(UUID userId) {
        return userId != null && bypassPolicy.evaluate(userId).grantsAll();
    }

    /**
     * Superuser or holder of the Global admin role.
     */
    public void requireAdmin(UUID userId) {
        if (!isAdmin(userId)) {
            log.warn("Access denied: user {} is not an administrator", userId);
            throwForbidden("Administrator required");
        }
    }

    private void throwForbidden(String message) {
        String msg = message != null ? message : DEFAULT_FORBIDDEN_MESSAGE;
        log.debug("ScopeAccessPolicy denying access: {}", msg);
        throw new ForbiddenException(msg);
    }
}
