package uk.gegc.flowrbac.features.rbac.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.application.store.RoleRecord;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.util.Identifiers;

import java.util.Optional;
import java.util.UUID;

/**
 * Single-check entry point.
 * <p>
 * Superusers and holders of the Global admin role pass every check without a role
 * being resolved. Everyone else needs a resolved role granting the permission for the
 * requested scope kind.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class PermissionChecker {

    private final PermissionStore store;
    private final BypassPolicy bypassPolicy;
    private final RoleResolver roleResolver;
    private final RbacMetricsService metrics;

    public boolean canAccess(UUID userId, String permissionName, ScopeType scopeType, UUID scopeId) {
        return canAccess(userId, PermissionCheck.of(permissionName, scopeType, scopeId));
    }

    /**
     * Text-typed variant; malformed identifiers or scope names raise instead of returning false.
     */
    public boolean canAccess(String userId, String permissionName, String scopeType, String scopeId) {
        return canAccess(Identifiers.parseRequired(userId, "user_id"),
                PermissionCheck.parse(permissionName, scopeType, scopeId));
    }

    public boolean canAccess(UUID userId, PermissionCheck check) {
        if (userId == null) {
            throw new ValidationException("user_id is required");
        }

        BypassPolicy.Bypass bypass = bypassPolicy.evaluate(userId);
        if (bypass.grantsAll()) {
            metrics.recordBypass(bypass, 1);
            return true;
        }

        Optional<RoleRecord> role = roleResolver.resolve(userId, check.scopeType(), check.scopeId());
        boolean granted = role
                .map(r -> store.roleHasPermission(r.id(), check.permissionName(), check.scopeType()))
                .orElse(false);

        log.debug("User {} {} for {} on {} {} (role: {})", userId, granted ? "granted" : "denied",
                check.permissionName(), check.scopeType(), check.scopeId(),
                role.map(RoleRecord::name).orElse("none"));
        metrics.recordDecision(granted);
        return granted;
    }
}
