package uk.gegc.flowrbac.features.rbac.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
@ToString
@Table(name = "permissions",
        uniqueConstraints = @UniqueConstraint(name = "uq_permission_name_scope", columnNames = {"permission_name", "scope_type"}))
public class Permission {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "permission_id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "permission_name", nullable = false, length = 50)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope_type", nullable = false, length = 20)
    private ScopeType scope;

    @Column(name = "description")
    private String description;
}
