package uk.gegc.flowrbac.features.rbac.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.AssignmentManager;
import uk.gegc.flowrbac.features.rbac.application.RbacMetricsService;
import uk.gegc.flowrbac.features.rbac.application.RoleResolver;
import uk.gegc.flowrbac.features.rbac.application.store.*;
import uk.gegc.flowrbac.features.rbac.domain.event.RoleAssignmentChangedEvent;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class AssignmentManagerImpl implements AssignmentManager {

    private final PermissionStore store;
    private final RoleResolver roleResolver;
    private final ApplicationEventPublisher eventPublisher;
    private final RbacMetricsService metrics;
    private final Clock clock;

    @Override
    public AssignmentRecord assignRole(UUID userId, String roleName, ScopeType scopeType, UUID scopeId, UUID createdBy) {
        return assignRole(userId, roleName, scopeType, scopeId, createdBy, false);
    }

    @Override
    public AssignmentRecord assignRole(UUID userId, String roleName, ScopeType scopeType, UUID scopeId,
                                       UUID createdBy, boolean immutable) {
        if (userId == null || store.findUser(userId).isEmpty()) {
            throw new UserNotFoundException(userId);
        }
        RoleRecord role = requireRole(roleName);
        ScopeRef scope = validateScope(scopeType, scopeId);

        if (store.findAssignment(userId, role.id(), scope).isPresent()) {
            throw new DuplicateAssignmentException();
        }

        Instant now = clock.instant();
        AssignmentRecord created = store.insertAssignment(
                new NewAssignment(userId, role.id(), scope, immutable, now, createdBy));

        metrics.incrementAssignmentCreated();
        eventPublisher.publishEvent(RoleAssignmentChangedEvent.assigned(this, created, createdBy, now));
        log.info("Assigned role {} to user {} at {} {} (immutable: {}, by: {})",
                role.name(), userId, scopeType, scopeId, immutable, createdBy != null ? createdBy : "system");
        return created;
    }

    @Override
    public void removeRole(UUID assignmentId) {
        removeRole(assignmentId, null);
    }

    @Override
    public void removeRole(UUID assignmentId, UUID actorId) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        if (assignment.immutable()) {
            throw new ImmutableAssignmentException(ImmutableAssignmentException.OPERATION_REMOVE);
        }

        store.deleteAssignment(assignmentId);

        metrics.incrementAssignmentRemoved(1);
        eventPublisher.publishEvent(RoleAssignmentChangedEvent.removed(this, assignment, actorId, clock.instant()));
        log.info("Removed role {} from user {} at {} {}",
                assignment.role().name(), assignment.userId(), assignment.scopeType(), assignment.scopeId());
    }

    @Override
    public AssignmentRecord updateRole(UUID assignmentId, String newRoleName) {
        return updateRole(assignmentId, newRoleName, null);
    }

    @Override
    public AssignmentRecord updateRole(UUID assignmentId, String newRoleName, UUID actorId) {
        AssignmentRecord assignment = requireAssignment(assignmentId);
        if (assignment.immutable()) {
            throw new ImmutableAssignmentException(ImmutableAssignmentException.OPERATION_MODIFY);
        }
        RoleRecord newRole = requireRole(newRoleName);
        if (newRole.id().equals(assignment.roleId())) {
            return assignment;
        }

        AssignmentRecord updated = store.updateAssignmentRole(assignmentId, newRole.id());

        metrics.incrementAssignmentUpdated();
        eventPublisher.publishEvent(RoleAssignmentChangedEvent.updated(this, assignment, updated, actorId, clock.instant()));
        log.info("Updated assignment {} for user {} from role {} to {}",
                assignmentId, assignment.userId(), assignment.role().name(), newRole.name());
        return updated;
    }

    @Override
    @Transactional(readOnly = true)
    public List<AssignmentRecord> listUserAssignments(UUID userId) {
        return store.findAssignments(userId);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AssignmentRecord> listAssignments(UUID userId, String roleName, ScopeType scopeType) {
        return store.findAssignments(userId).stream()
                .filter(a -> roleName == null || a.role().name().equals(roleName))
                .filter(a -> scopeType == null || a.scopeType() == scopeType)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<PermissionRecord> getUserPermissionsForScope(UUID userId, ScopeType scopeType, UUID scopeId) {
        if (scopeType == null) {
            throw new InvalidScopeException("scope_type is required");
        }
        Optional<RoleRecord> role = roleResolver.resolve(userId, scopeType, scopeId);
        return role
                .map(r -> store.findRolePermissions(r.id(), scopeType))
                .orElse(List.of());
    }

    @Override
    @Transactional(readOnly = true)
    public List<RoleRecord> listRoles() {
        return store.findAllRoles();
    }

    @Override
    public int removeAssignmentsForScope(ScopeType scopeType, UUID scopeId) {
        if (scopeType == null || !scopeType.requiresScopeId() || scopeId == null) {
            throw new InvalidScopeException("Only Project and Flow assignments are removed with their resource");
        }
        int removed = store.deleteAssignmentsAtScope(ScopeRef.of(scopeType, scopeId));
        if (removed > 0) {
            metrics.incrementAssignmentRemoved(removed);
            log.info("Removed {} assignment(s) scoped to deleted {} {}", removed, scopeType, scopeId);
        }
        return removed;
    }

    private RoleRecord requireRole(String roleName) {
        if (roleName == null || roleName.isBlank()) {
            throw new RoleNotFoundException(String.valueOf(roleName));
        }
        return store.findRoleByName(roleName)
                .orElseThrow(() -> new RoleNotFoundException(roleName));
    }

    private AssignmentRecord requireAssignment(UUID assignmentId) {
        if (assignmentId == null) {
            throw new AssignmentNotFoundException(null);
        }
        return store.findAssignmentById(assignmentId)
                .orElseThrow(() -> new AssignmentNotFoundException(assignmentId));
    }

    private ScopeRef validateScope(ScopeType scopeType, UUID scopeId) {
        if (scopeType == null) {
            throw new InvalidScopeException("scope_type is required");
        }
        if (!scopeType.requiresScopeId()) {
            if (scopeId != null) {
                throw new InvalidScopeException("Global scope must not have a scope_id");
            }
            return ScopeRef.global();
        }
        if (scopeId == null) {
            throw new InvalidScopeException(scopeType.getValue() + " scope requires a scope_id");
        }
        if (!store.resourceExists(scopeType, scopeId)) {
            throw new ResourceNotFoundException(scopeType.getValue(), scopeId);
        }
        return ScopeRef.of(scopeType, scopeId);
    }
}
