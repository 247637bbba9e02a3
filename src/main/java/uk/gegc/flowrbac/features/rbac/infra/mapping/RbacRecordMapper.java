package uk.gegc.flowrbac.features.rbac.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionRecord;
import uk.gegc.flowrbac.features.rbac.application.store.RoleRecord;
import uk.gegc.flowrbac.features.rbac.application.store.UserRecord;
import uk.gegc.flowrbac.features.rbac.domain.model.Permission;
import uk.gegc.flowrbac.features.rbac.domain.model.Role;
import uk.gegc.flowrbac.features.rbac.domain.model.UserRoleAssignment;
import uk.gegc.flowrbac.features.user.domain.model.User;

import java.util.List;

@Component
public class RbacRecordMapper {

    public UserRecord toRecord(User user) {
        if (user == null) {
            return null;
        }
        return new UserRecord(user.getId(), user.getUsername(), user.isSuperuser());
    }

    public RoleRecord toRecord(Role role) {
        if (role == null) {
            return null;
        }
        return new RoleRecord(role.getId(), role.getName(), role.getDescription(), role.isSystemRole());
    }

    public PermissionRecord toRecord(Permission permission) {
        if (permission == null) {
            return null;
        }
        return new PermissionRecord(permission.getId(), permission.getName(), permission.getScope(), permission.getDescription());
    }

    /**
     * Expects the role association to be initialised.
     */
    public AssignmentRecord toRecord(UserRoleAssignment assignment) {
        if (assignment == null) {
            return null;
        }
        return new AssignmentRecord(
                assignment.getId(),
                assignment.getUserId(),
                toRecord(assignment.getRole()),
                assignment.getScopeType(),
                assignment.getScopeId(),
                assignment.isImmutable(),
                assignment.getCreatedAt(),
                assignment.getCreatedBy()
        );
    }

    public List<AssignmentRecord> toAssignmentRecords(List<UserRoleAssignment> assignments) {
        return assignments.stream()
                .map(this::toRecord)
                .toList();
    }
}
