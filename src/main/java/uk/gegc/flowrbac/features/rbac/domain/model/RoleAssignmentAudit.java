package uk.gegc.flowrbac.features.rbac.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "role_assignment_audit",
        indexes = @Index(name = "idx_audit_assignment", columnList = "assignment_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RoleAssignmentAudit {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(name = "audit_action", nullable = false, length = 30)
    private AuditAction action;

    @Column(name = "assignment_id", nullable = false)
    private UUID assignmentId;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, length = 20)
    private ScopeType scopeType;

    @Column(name = "scope_id")
    private UUID scopeId;

    @Column(name = "actor_id")
    private UUID actorId;

    @Column(name = "before_state", columnDefinition = "TEXT")
    private String beforeState;

    @Column(name = "after_state", columnDefinition = "TEXT")
    private String afterState;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    public enum AuditAction {
        ROLE_ASSIGNED,
        ROLE_UPDATED,
        ROLE_REMOVED
    }
}
