package uk.gegc.flowrbac.features.rbac.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.rbac.application.store.RoleGrant;
import uk.gegc.flowrbac.features.rbac.domain.model.Permission;
import uk.gegc.flowrbac.features.rbac.domain.model.RolePermission;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface RolePermissionRepository extends JpaRepository<RolePermission, UUID> {

    boolean existsByRole_IdAndPermission_Id(UUID roleId, UUID permissionId);

    boolean existsByRole_IdAndPermission_NameAndPermission_Scope(UUID roleId, String permissionName, ScopeType scope);

    @Query("SELECT p FROM RolePermission rp JOIN rp.permission p " +
           "WHERE rp.role.id = :roleId AND p.scope = :scope ORDER BY p.name")
    List<Permission> findPermissionsForRole(@Param("roleId") UUID roleId, @Param("scope") ScopeType scope);

    /**
     * Every (role, permission, scope) grant held by the given roles in one query.
     */
    @Query("SELECT new uk.gegc.flowrbac.features.rbac.application.store.RoleGrant(rp.role.id, p.name, p.scope) " +
           "FROM RolePermission rp JOIN rp.permission p WHERE rp.role.id IN :roleIds")
    List<RoleGrant> findGrants(@Param("roleIds") Collection<UUID> roleIds);
}
