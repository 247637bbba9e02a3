package uk.gegc.flowrbac.features.rbac.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.shared.exception.ValidationException;

import java.time.Duration;
import java.util.*;

/**
 * Multi-check entry point.
 * <p>
 * Issues a fixed number of store calls whatever the number of checks: the two bypass
 * lookups, one parent lookup per inheritance hop in use, one assignment query and one
 * grant query. Answers are identical to calling {@link PermissionChecker} once per check.
 */
@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class BatchPermissionChecker {

    private final PermissionStore store;
    private final BypassPolicy bypassPolicy;
    private final ScopeHierarchy hierarchy;
    private final RbacMetricsService metrics;

    /**
     * @return one answer per check, in input order
     */
    public List<Boolean> batchCanAccess(UUID userId, List<PermissionCheck> checks) {
        if (userId == null) {
            throw new ValidationException("user_id is required");
        }
        if (checks == null) {
            throw new ValidationException("checks are required");
        }
        if (checks.isEmpty()) {
            return List.of();
        }

        long started = System.nanoTime();

        BypassPolicy.Bypass bypass = bypassPolicy.evaluate(userId);
        if (bypass.grantsAll()) {
            metrics.recordBypass(bypass, checks.size());
            return Collections.nCopies(checks.size(), Boolean.TRUE);
        }

        Set<ScopeRef> requested = new LinkedHashSet<>();
        for (PermissionCheck check : checks) {
            requested.add(check.scope());
        }

        Map<ScopeRef, ScopeRef> inheritedParents = lookupParents(requested);

        Set<ScopeRef> lookupScopes = new LinkedHashSet<>(requested);
        lookupScopes.addAll(inheritedParents.values());
        List<AssignmentRecord> assignments = store.findAssignmentsAtScopes(userId, lookupScopes);

        Map<ScopeRef, UUID> scopeRoles = BatchResolution.resolveScopeRoles(requested, inheritedParents, assignments);
        Set<BatchResolution.GrantKey> grants = BatchResolution.indexGrants(
                store.findGrants(new HashSet<>(scopeRoles.values())));

        List<Boolean> results = BatchResolution.evaluate(checks, scopeRoles, grants);

        metrics.recordDecisions(results);
        metrics.recordBatchLatency(Duration.ofNanos(System.nanoTime() - started), checks.size());
        log.debug("Batch for user {}: {} check(s), {} scope(s), {} role(s) resolved",
                userId, checks.size(), requested.size(), scopeRoles.size());
        return results;
    }

    private Map<ScopeRef, ScopeRef> lookupParents(Set<ScopeRef> requested) {
        Map<ScopeRef, ScopeRef> inheritedParents = new HashMap<>();
        for (InheritanceEdge edge : hierarchy.edges()) {
            Set<UUID> childIds = new HashSet<>();
            for (ScopeRef scope : requested) {
                if (scope.type() == edge.child() && scope.id() != null) {
                    childIds.add(scope.id());
                }
            }
            if (childIds.isEmpty()) {
                continue;
            }
            edge.parentsOf(childIds).forEach((childId, parentId) ->
                    inheritedParents.put(ScopeRef.of(edge.child(), childId), ScopeRef.of(edge.parent(), parentId)));
        }
        return inheritedParents;
    }
}
