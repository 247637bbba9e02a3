package uk.gegc.flowrbac.features.rbac.infra;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;
import uk.gegc.flowrbac.features.project.domain.model.Project;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.application.store.NewAssignment;
import uk.gegc.flowrbac.features.rbac.application.store.RoleGrant;
import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.features.rbac.domain.model.Permission;
import uk.gegc.flowrbac.features.rbac.domain.model.Role;
import uk.gegc.flowrbac.features.rbac.domain.model.RolePermission;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.infra.mapping.RbacRecordMapper;
import uk.gegc.flowrbac.features.user.domain.model.User;
import uk.gegc.flowrbac.shared.exception.DuplicateAssignmentException;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@Import({JpaPermissionStore.class, RbacRecordMapper.class})
class JpaPermissionStoreTest {

    private static final Instant T0 = Instant.parse("2024-01-01T12:00:00Z");

    @Autowired
    private JpaPermissionStore store;

    @Autowired
    private TestEntityManager entityManager;

    private User alice;
    private Role viewer;
    private Role editor;

    @BeforeEach
    void setUp() {
        alice = entityManager.persist(User.builder().username("alice").build());
        viewer = entityManager.persist(Role.builder().name("Viewer").isSystemRole(true).build());
        editor = entityManager.persist(Role.builder().name("Editor").isSystemRole(true).build());

        Permission readProject = entityManager.persist(Permission.builder().name("Read").scope(ScopeType.PROJECT).build());
        Permission readFlow = entityManager.persist(Permission.builder().name("Read").scope(ScopeType.FLOW).build());
        Permission updateFlow = entityManager.persist(Permission.builder().name("Update").scope(ScopeType.FLOW).build());
        entityManager.persist(RolePermission.builder().role(viewer).permission(readProject).build());
        entityManager.persist(RolePermission.builder().role(viewer).permission(readFlow).build());
        entityManager.persist(RolePermission.builder().role(editor).permission(readFlow).build());
        entityManager.persist(RolePermission.builder().role(editor).permission(updateFlow).build());
        entityManager.flush();
    }

    @Test
    @DisplayName("roleHasPermission matches name and scope kind exactly")
    void roleHasPermission_matchesNameAndScope() {
        assertThat(store.roleHasPermission(viewer.getId(), "Read", ScopeType.PROJECT)).isTrue();
        assertThat(store.roleHasPermission(viewer.getId(), "Update", ScopeType.FLOW)).isFalse();
        assertThat(store.roleHasPermission(editor.getId(), "Read", ScopeType.PROJECT)).isFalse();
        assertThat(store.roleHasPermission(viewer.getId(), "Nonexistent", ScopeType.FLOW)).isFalse();
    }

    @Test
    @DisplayName("findGrants returns every grant of the requested roles")
    void findGrants_returnsAllGrantsOfRequestedRoles() {
        List<RoleGrant> grants = store.findGrants(List.of(editor.getId()));

        assertThat(grants).containsExactlyInAnyOrder(
                new RoleGrant(editor.getId(), "Read", ScopeType.FLOW),
                new RoleGrant(editor.getId(), "Update", ScopeType.FLOW));
        assertThat(store.findGrants(List.of())).isEmpty();
    }

    @Test
    @DisplayName("findDirectAssignment returns the oldest assignment at the scope")
    void findDirectAssignment_whenSeveralRoles_thenOldestWins() {
        UUID projectId = persistProject(alice.getId()).getId();
        ScopeRef scope = ScopeRef.of(ScopeType.PROJECT, projectId);
        store.insertAssignment(new NewAssignment(alice.getId(), editor.getId(), scope, false, T0.plusSeconds(5), null));
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(), scope, false, T0, null));
        entityManager.clear();

        AssignmentRecord direct = store.findDirectAssignment(alice.getId(), scope).orElseThrow();

        assertThat(direct.role().name()).isEqualTo("Viewer");
        assertThat(store.findDirectAssignment(alice.getId(), ScopeRef.of(ScopeType.FLOW, projectId))).isEmpty();
    }

    @Test
    @DisplayName("findAssignmentsAtScopes loads several scopes in precedence order")
    void findAssignmentsAtScopes_returnsOrderedAssignments() {
        UUID projectId = persistProject(alice.getId()).getId();
        UUID otherProjectId = persistProject(alice.getId()).getId();
        store.insertAssignment(new NewAssignment(alice.getId(), editor.getId(),
                ScopeRef.of(ScopeType.PROJECT, otherProjectId), false, T0.plusSeconds(1), null));
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(),
                ScopeRef.of(ScopeType.PROJECT, projectId), false, T0, null));
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(),
                ScopeRef.global(), false, T0, null));
        entityManager.clear();

        List<AssignmentRecord> found = store.findAssignmentsAtScopes(alice.getId(), List.of(
                ScopeRef.of(ScopeType.PROJECT, projectId), ScopeRef.of(ScopeType.PROJECT, otherProjectId)));

        assertThat(found).extracting(AssignmentRecord::scopeId).containsExactly(projectId, otherProjectId);
    }

    @Test
    @DisplayName("insertAssignment: same user, role and project twice is rejected by the unique key")
    void insertAssignment_whenDuplicateProject_thenThrowsDuplicate() {
        UUID projectId = persistProject(alice.getId()).getId();
        ScopeRef scope = ScopeRef.of(ScopeType.PROJECT, projectId);
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(), scope, false, T0, null));

        assertThatThrownBy(() -> store.insertAssignment(
                new NewAssignment(alice.getId(), viewer.getId(), scope, false, T0.plusSeconds(1), null)))
                .isInstanceOf(DuplicateAssignmentException.class);
    }

    @Test
    @DisplayName("insertAssignment: Global assignments are unique even though scope id is null")
    void insertAssignment_whenDuplicateGlobal_thenThrowsDuplicate() {
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(), ScopeRef.global(), false, T0, null));

        assertThatThrownBy(() -> store.insertAssignment(
                new NewAssignment(alice.getId(), viewer.getId(), ScopeRef.global(), false, T0, null)))
                .isInstanceOf(DuplicateAssignmentException.class);
    }

    @Test
    @DisplayName("hasGlobalRole only considers Global assignments")
    void hasGlobalRole_ignoresResourceScopedAssignments() {
        UUID projectId = persistProject(alice.getId()).getId();
        store.insertAssignment(new NewAssignment(alice.getId(), editor.getId(),
                ScopeRef.of(ScopeType.PROJECT, projectId), false, T0, null));

        assertThat(store.hasGlobalRole(alice.getId(), "Editor")).isFalse();

        store.insertAssignment(new NewAssignment(alice.getId(), editor.getId(), ScopeRef.global(), false, T0, null));

        assertThat(store.hasGlobalRole(alice.getId(), "Editor")).isTrue();
    }

    @Test
    @DisplayName("findFlowParentProjectIds maps contained flows and omits standalone ones")
    void findFlowParentProjectIds_omitsStandaloneFlows() {
        Project project = persistProject(alice.getId());
        Flow contained = entityManager.persist(Flow.builder().name("contained").folderId(project.getId()).build());
        Flow standalone = entityManager.persist(Flow.builder().name("standalone").build());
        entityManager.flush();

        Map<UUID, UUID> parents = store.findFlowParentProjectIds(List.of(contained.getId(), standalone.getId()));

        assertThat(parents).containsOnly(Map.entry(contained.getId(), project.getId()));
        assertThat(store.findFlowParentProjectId(standalone.getId())).isEmpty();
        assertThat(store.resourceExists(ScopeType.FLOW, standalone.getId())).isTrue();
        assertThat(store.resourceExists(ScopeType.PROJECT, UUID.randomUUID())).isFalse();
    }

    @Test
    @DisplayName("deleteAssignmentsAtScope removes every assignment at that scope only")
    void deleteAssignmentsAtScope_removesOnlyThatScope() {
        UUID projectId = persistProject(alice.getId()).getId();
        UUID keptProjectId = persistProject(alice.getId()).getId();
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(),
                ScopeRef.of(ScopeType.PROJECT, projectId), true, T0, null));
        store.insertAssignment(new NewAssignment(alice.getId(), editor.getId(),
                ScopeRef.of(ScopeType.PROJECT, projectId), false, T0, null));
        store.insertAssignment(new NewAssignment(alice.getId(), viewer.getId(),
                ScopeRef.of(ScopeType.PROJECT, keptProjectId), false, T0, null));

        int removed = store.deleteAssignmentsAtScope(ScopeRef.of(ScopeType.PROJECT, projectId));

        assertThat(removed).isEqualTo(2);
        assertThat(store.findAssignments(alice.getId()))
                .extracting(AssignmentRecord::scopeId)
                .containsExactly(keptProjectId);
    }

    private Project persistProject(UUID ownerId) {
        Project project = entityManager.persist(Project.builder().name("Project").userId(ownerId).build());
        entityManager.flush();
        return project;
    }
}
