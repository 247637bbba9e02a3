package uk.gegc.flowrbac.features.rbac.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Binds a user to a role at one scope instance, or globally.
 * <p>
 * {@code scope_key} folds scope type and id into a single non-null column so the
 * unique constraint also covers Global rows, whose {@code scope_id} is null.
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString(exclude = "role")
@Table(name = "user_role_assignments",
        uniqueConstraints = @UniqueConstraint(name = "uq_user_role_scope", columnNames = {"user_id", "role_id", "scope_key"}),
        indexes = {
                @Index(name = "idx_assignment_user_scope", columnList = "user_id, scope_key"),
                @Index(name = "idx_assignment_scope", columnList = "scope_key")
        })
public class UserRoleAssignment {

    private static final String GLOBAL_SCOPE_ID = "*";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private UUID userId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "role_id", nullable = false)
    private Role role;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, length = 20)
    private ScopeType scopeType;

    @Column(name = "scope_id")
    private UUID scopeId;

    @Column(name = "scope_key", nullable = false, length = 64)
    private String scopeKey;

    @Column(name = "is_immutable", nullable = false)
    @Builder.Default
    private boolean isImmutable = false;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "created_by")
    private UUID createdBy;

    @PrePersist
    @PreUpdate
    void syncScopeKey() {
        this.scopeKey = scopeKey(scopeType, scopeId);
    }

    public static String scopeKey(ScopeType scopeType, UUID scopeId) {
        return scopeType.name() + ":" + (scopeId == null ? GLOBAL_SCOPE_ID : scopeId.toString());
    }
}
