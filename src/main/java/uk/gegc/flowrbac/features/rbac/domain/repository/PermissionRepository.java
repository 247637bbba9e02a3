package uk.gegc.flowrbac.features.rbac.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.rbac.domain.model.Permission;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PermissionRepository extends JpaRepository<Permission, UUID> {

    Optional<Permission> findByNameAndScope(String name, ScopeType scope);
}
