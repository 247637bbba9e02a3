package uk.gegc.flowrbac.features.rbac.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.rbac.domain.model.RoleAssignmentAudit;

import java.util.List;
import java.util.UUID;

@Repository
public interface RoleAssignmentAuditRepository extends JpaRepository<RoleAssignmentAudit, UUID> {

    List<RoleAssignmentAudit> findByAssignmentIdOrderByCreatedAtAsc(UUID assignmentId);

    List<RoleAssignmentAudit> findByUserIdOrderByCreatedAtAsc(UUID userId);
}
