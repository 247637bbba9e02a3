package uk.gegc.flowrbac.features.rbac.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.application.store.UserRecord;
import uk.gegc.flowrbac.shared.config.RbacProperties;

import java.util.UUID;

/**
 * Shortcuts that grant every check without resolving a role.
 */
@Component
@RequiredArgsConstructor
public class BypassPolicy {

    private final PermissionStore store;
    private final RbacProperties properties;

    public enum Bypass {
        SUPERUSER,
        GLOBAL_ADMIN,
        NONE;

        public boolean grantsAll() {
            return this != NONE;
        }
    }

    /**
     * The superuser flag is consulted first and, when set, no further query is made.
     */
    public Bypass evaluate(UUID userId) {
        boolean superuser = store.findUser(userId)
                .map(UserRecord::superuser)
                .orElse(false);
        if (superuser) {
            return Bypass.SUPERUSER;
        }
        if (store.hasGlobalRole(userId, properties.getAdminRoleName())) {
            return Bypass.GLOBAL_ADMIN;
        }
        return Bypass.NONE;
    }
}
