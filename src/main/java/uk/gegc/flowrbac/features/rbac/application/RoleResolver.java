package uk.gegc.flowrbac.features.rbac.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.application.store.RoleRecord;
import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.Optional;
import java.util.UUID;

/**
 * Resolves the single effective role of a user at a scope.
 * <p>
 * A direct assignment at the requested scope always wins. Otherwise one inheritance
 * hop from {@link ScopeHierarchy} is tried, and only a direct assignment on the
 * parent counts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class RoleResolver {

    private final PermissionStore store;
    private final ScopeHierarchy hierarchy;

    public Optional<RoleRecord> resolve(UUID userId, ScopeType scopeType, UUID scopeId) {
        Optional<AssignmentRecord> direct = store.findDirectAssignment(userId, ScopeRef.of(scopeType, scopeId));
        if (direct.isPresent()) {
            return Optional.of(direct.get().role());
        }
        if (scopeId == null) {
            return Optional.empty();
        }

        Optional<InheritanceEdge> edge = hierarchy.parentEdge(scopeType);
        if (edge.isEmpty()) {
            return Optional.empty();
        }
        Optional<UUID> parentId = edge.get().parentOf(scopeId);
        if (parentId.isEmpty()) {
            log.debug("No parent {} for {} {}; nothing to inherit", edge.get().parent(), scopeType, scopeId);
            return Optional.empty();
        }

        return store.findDirectAssignment(userId, ScopeRef.of(edge.get().parent(), parentId.get()))
                .map(AssignmentRecord::role);
    }
}
