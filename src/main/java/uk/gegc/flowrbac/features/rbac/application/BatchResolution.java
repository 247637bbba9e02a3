package uk.gegc.flowrbac.features.rbac.application;

import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.RoleGrant;
import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.*;

/**
 * In-memory stages of batch resolution. Nothing here touches the store.
 */
public final class BatchResolution {

    private BatchResolution() {
    }

    /**
     * A role granting a permission for one scope kind.
     */
    public record GrantKey(UUID roleId, String permissionName, ScopeType scope) {
    }

    /**
     * Maps every requested scope to its effective role id.
     * <p>
     * A direct assignment on the requested scope wins; failing that, the direct
     * assignment on its inherited parent applies. Among several assignments at the
     * same scope the first in list order wins. Scopes without a role are absent.
     *
     * @param requested        scopes named by the checks
     * @param inheritedParents parent scope keyed by child scope, one hop
     * @param assignments      the user's assignments at requested and parent scopes, in precedence order
     */
    public static Map<ScopeRef, UUID> resolveScopeRoles(Collection<ScopeRef> requested,
                                                        Map<ScopeRef, ScopeRef> inheritedParents,
                                                        List<AssignmentRecord> assignments) {
        Map<ScopeRef, UUID> direct = new HashMap<>();
        for (AssignmentRecord assignment : assignments) {
            direct.putIfAbsent(assignment.scope(), assignment.roleId());
        }

        Map<ScopeRef, UUID> resolved = new HashMap<>();
        for (ScopeRef scope : requested) {
            UUID roleId = direct.get(scope);
            if (roleId == null) {
                ScopeRef parent = inheritedParents.get(scope);
                if (parent != null) {
                    roleId = direct.get(parent);
                }
            }
            if (roleId != null) {
                resolved.put(scope, roleId);
            }
        }
        return resolved;
    }

    public static Set<GrantKey> indexGrants(Collection<RoleGrant> grants) {
        Set<GrantKey> index = new HashSet<>();
        for (RoleGrant grant : grants) {
            index.add(new GrantKey(grant.roleId(), grant.permissionName(), grant.scope()));
        }
        return index;
    }

    /**
     * Answers each check in input order. The permission is looked up for the scope kind
     * of the check, including when the role was inherited from a parent of another kind.
     */
    public static List<Boolean> evaluate(List<PermissionCheck> checks,
                                         Map<ScopeRef, UUID> scopeRoles,
                                         Set<GrantKey> grants) {
        List<Boolean> results = new ArrayList<>(checks.size());
        for (PermissionCheck check : checks) {
            UUID roleId = scopeRoles.get(check.scope());
            results.add(roleId != null
                    && grants.contains(new GrantKey(roleId, check.permissionName(), check.scopeType())));
        }
        return results;
    }
}
