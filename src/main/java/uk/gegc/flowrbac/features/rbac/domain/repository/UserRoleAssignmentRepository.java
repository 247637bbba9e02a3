package uk.gegc.flowrbac.features.rbac.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.domain.model.UserRoleAssignment;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserRoleAssignmentRepository extends JpaRepository<UserRoleAssignment, UUID> {

    /**
     * Direct assignments of a user at one scope, oldest first, with roles fetched.
     */
    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role " +
           "WHERE a.userId = :userId AND a.scopeKey = :scopeKey ORDER BY a.createdAt ASC, a.id ASC")
    List<UserRoleAssignment> findAtScope(@Param("userId") UUID userId, @Param("scopeKey") String scopeKey);

    /**
     * Direct assignments of a user across several scopes in one query, oldest first.
     */
    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role " +
           "WHERE a.userId = :userId AND a.scopeKey IN :scopeKeys ORDER BY a.createdAt ASC, a.id ASC")
    List<UserRoleAssignment> findAtScopes(@Param("userId") UUID userId, @Param("scopeKeys") Collection<String> scopeKeys);

    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role " +
           "WHERE a.userId = :userId AND a.role.id = :roleId AND a.scopeKey = :scopeKey")
    Optional<UserRoleAssignment> findExact(@Param("userId") UUID userId,
                                           @Param("roleId") UUID roleId,
                                           @Param("scopeKey") String scopeKey);

    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role WHERE a.id = :id")
    Optional<UserRoleAssignment> findByIdWithRole(@Param("id") UUID id);

    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role ORDER BY a.createdAt ASC, a.id ASC")
    List<UserRoleAssignment> findAllWithRole();

    @Query("SELECT a FROM UserRoleAssignment a JOIN FETCH a.role " +
           "WHERE a.userId = :userId ORDER BY a.createdAt ASC, a.id ASC")
    List<UserRoleAssignment> findAllByUserIdWithRole(@Param("userId") UUID userId);

    boolean existsByUserIdAndScopeTypeAndRole_Name(UUID userId, ScopeType scopeType, String roleName);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM UserRoleAssignment a WHERE a.scopeKey = :scopeKey")
    int deleteByScopeKey(@Param("scopeKey") String scopeKey);
}
