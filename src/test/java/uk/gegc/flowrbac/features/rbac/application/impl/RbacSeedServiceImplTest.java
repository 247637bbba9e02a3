package uk.gegc.flowrbac.features.rbac.application.impl;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.ImportAutoConfiguration;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;
import uk.gegc.flowrbac.features.rbac.application.RbacSeedService;
import uk.gegc.flowrbac.features.rbac.application.RbacSeedService.SeedResult;
import uk.gegc.flowrbac.features.rbac.domain.model.Role;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.domain.repository.PermissionRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.RolePermissionRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.RoleRepository;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@ActiveProfiles("test")
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@ImportAutoConfiguration(JacksonAutoConfiguration.class)
@Import(RbacSeedServiceImpl.class)
class RbacSeedServiceImplTest {

    @Autowired
    private RbacSeedService seedService;

    @Autowired
    private RoleRepository roleRepository;

    @Autowired
    private PermissionRepository permissionRepository;

    @Autowired
    private RolePermissionRepository rolePermissionRepository;

    @Test
    @DisplayName("seed: creates the default roles, permissions and grants")
    void seed_whenEmpty_thenCreatesDefaultPolicy() {
        SeedResult result = seedService.seed();

        assertThat(result).isEqualTo(new SeedResult(8, 4, 24));
        assertThat(roleRepository.findAll()).extracting(Role::getName)
                .containsExactlyInAnyOrder("Viewer", "Editor", "Owner", "Admin");

        Role viewer = roleRepository.findByName("Viewer").orElseThrow();
        assertThat(rolePermissionRepository.existsByRole_IdAndPermission_NameAndPermission_Scope(
                viewer.getId(), "Read", ScopeType.FLOW)).isTrue();
        assertThat(rolePermissionRepository.existsByRole_IdAndPermission_NameAndPermission_Scope(
                viewer.getId(), "Update", ScopeType.FLOW)).isFalse();

        Role editor = roleRepository.findByName("Editor").orElseThrow();
        assertThat(rolePermissionRepository.existsByRole_IdAndPermission_NameAndPermission_Scope(
                editor.getId(), "Delete", ScopeType.PROJECT)).isFalse();
    }

    @Test
    @DisplayName("seed: second run changes nothing")
    void seed_whenAlreadySeeded_thenIsIdempotent() {
        seedService.seed();

        SeedResult second = seedService.seed();

        assertThat(second.changed()).isFalse();
        assertThat(permissionRepository.count()).isEqualTo(8);
        assertThat(rolePermissionRepository.count()).isEqualTo(24);
    }
}
