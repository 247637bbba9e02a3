package uk.gegc.flowrbac.features.rbac.infra;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.flow.domain.repository.FlowParent;
import uk.gegc.flowrbac.features.flow.domain.repository.FlowRepository;
import uk.gegc.flowrbac.features.project.domain.repository.ProjectRepository;
import uk.gegc.flowrbac.features.rbac.application.store.*;
import uk.gegc.flowrbac.features.rbac.domain.model.Role;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.domain.model.UserRoleAssignment;
import uk.gegc.flowrbac.features.rbac.domain.repository.RolePermissionRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.RoleRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.UserRoleAssignmentRepository;
import uk.gegc.flowrbac.features.rbac.infra.mapping.RbacRecordMapper;
import uk.gegc.flowrbac.features.user.domain.repository.UserRepository;
import uk.gegc.flowrbac.shared.exception.AssignmentNotFoundException;
import uk.gegc.flowrbac.shared.exception.DuplicateAssignmentException;
import uk.gegc.flowrbac.shared.exception.RoleNotFoundException;

import java.util.*;
import java.util.stream.Collectors;

/**
 * {@link PermissionStore} backed by the relational schema through Spring Data JPA.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaPermissionStore implements PermissionStore {

    private final UserRepository userRepository;
    private final RoleRepository roleRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final UserRoleAssignmentRepository assignmentRepository;
    private final ProjectRepository projectRepository;
    private final FlowRepository flowRepository;
    private final RbacRecordMapper mapper;

    @Override
    public Optional<UserRecord> findUser(UUID userId) {
        return userRepository.findById(userId).map(mapper::toRecord);
    }

    @Override
    public Optional<RoleRecord> findRoleByName(String name) {
        return roleRepository.findByName(name).map(mapper::toRecord);
    }

    @Override
    public List<RoleRecord> findAllRoles() {
        return roleRepository.findAllByOrderByNameAsc().stream()
                .map(mapper::toRecord)
                .toList();
    }

    @Override
    public boolean roleHasPermission(UUID roleId, String permissionName, ScopeType scope) {
        return rolePermissionRepository.existsByRole_IdAndPermission_NameAndPermission_Scope(roleId, permissionName, scope);
    }

    @Override
    public List<PermissionRecord> findRolePermissions(UUID roleId, ScopeType scope) {
        return rolePermissionRepository.findPermissionsForRole(roleId, scope).stream()
                .map(mapper::toRecord)
                .toList();
    }

    @Override
    public List<RoleGrant> findGrants(Collection<UUID> roleIds) {
        if (roleIds.isEmpty()) {
            return List.of();
        }
        return rolePermissionRepository.findGrants(roleIds);
    }

    @Override
    public boolean hasGlobalRole(UUID userId, String roleName) {
        return assignmentRepository.existsByUserIdAndScopeTypeAndRole_Name(userId, ScopeType.GLOBAL, roleName);
    }

    @Override
    public Optional<AssignmentRecord> findDirectAssignment(UUID userId, ScopeRef scope) {
        return assignmentRepository.findAtScope(userId, scope.key()).stream()
                .findFirst()
                .map(mapper::toRecord);
    }

    @Override
    public List<AssignmentRecord> findAssignmentsAtScopes(UUID userId, Collection<ScopeRef> scopes) {
        if (scopes.isEmpty()) {
            return List.of();
        }
        Set<String> keys = scopes.stream()
                .map(ScopeRef::key)
                .collect(Collectors.toSet());
        return mapper.toAssignmentRecords(assignmentRepository.findAtScopes(userId, keys));
    }

    @Override
    public Optional<AssignmentRecord> findAssignment(UUID userId, UUID roleId, ScopeRef scope) {
        return assignmentRepository.findExact(userId, roleId, scope.key()).map(mapper::toRecord);
    }

    @Override
    public Optional<AssignmentRecord> findAssignmentById(UUID assignmentId) {
        return assignmentRepository.findByIdWithRole(assignmentId).map(mapper::toRecord);
    }

    @Override
    public List<AssignmentRecord> findAssignments(UUID userId) {
        List<UserRoleAssignment> assignments = userId == null
                ? assignmentRepository.findAllWithRole()
                : assignmentRepository.findAllByUserIdWithRole(userId);
        return mapper.toAssignmentRecords(assignments);
    }

    @Override
    @Transactional
    public AssignmentRecord insertAssignment(NewAssignment assignment) {
        Role role = roleRepository.findById(assignment.roleId())
                .orElseThrow(() -> new RoleNotFoundException(assignment.roleId().toString()));

        UserRoleAssignment entity = UserRoleAssignment.builder()
                .userId(assignment.userId())
                .role(role)
                .scopeType(assignment.scope().type())
                .scopeId(assignment.scope().id())
                .isImmutable(assignment.immutable())
                .createdAt(assignment.createdAt())
                .createdBy(assignment.createdBy())
                .build();

        try {
            return mapper.toRecord(assignmentRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            log.debug("Unique constraint rejected assignment of role {} to user {} at {}",
                    role.getName(), assignment.userId(), assignment.scope().key());
            throw new DuplicateAssignmentException(e);
        }
    }

    @Override
    @Transactional
    public AssignmentRecord updateAssignmentRole(UUID assignmentId, UUID roleId) {
        UserRoleAssignment entity = assignmentRepository.findByIdWithRole(assignmentId)
                .orElseThrow(() -> new AssignmentNotFoundException(assignmentId));
        Role role = roleRepository.findById(roleId)
                .orElseThrow(() -> new RoleNotFoundException(roleId.toString()));

        entity.setRole(role);
        try {
            return mapper.toRecord(assignmentRepository.saveAndFlush(entity));
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateAssignmentException(e);
        }
    }

    @Override
    @Transactional
    public void deleteAssignment(UUID assignmentId) {
        assignmentRepository.deleteById(assignmentId);
    }

    @Override
    @Transactional
    public int deleteAssignmentsAtScope(ScopeRef scope) {
        return assignmentRepository.deleteByScopeKey(scope.key());
    }

    @Override
    public boolean projectExists(UUID projectId) {
        return projectId != null && projectRepository.existsById(projectId);
    }

    @Override
    public boolean flowExists(UUID flowId) {
        return flowId != null && flowRepository.existsById(flowId);
    }

    @Override
    public Optional<UUID> findFlowParentProjectId(UUID flowId) {
        return Optional.ofNullable(findFlowParentProjectIds(List.of(flowId)).get(flowId));
    }

    @Override
    public Map<UUID, UUID> findFlowParentProjectIds(Collection<UUID> flowIds) {
        if (flowIds.isEmpty()) {
            return Map.of();
        }
        Map<UUID, UUID> parents = new HashMap<>();
        for (FlowParent parent : flowRepository.findParents(flowIds)) {
            parents.put(parent.flowId(), parent.projectId());
        }
        return parents;
    }
}
