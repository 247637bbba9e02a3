package uk.gegc.flowrbac.features.rbac.application.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.rbac.application.RbacSeedService;
import uk.gegc.flowrbac.features.rbac.domain.model.Permission;
import uk.gegc.flowrbac.features.rbac.domain.model.Role;
import uk.gegc.flowrbac.features.rbac.domain.model.RolePermission;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.rbac.domain.repository.PermissionRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.RolePermissionRepository;
import uk.gegc.flowrbac.features.rbac.domain.repository.RoleRepository;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class RbacSeedServiceImpl implements RbacSeedService {

    static final String POLICY_PATH = "policy/rbac-default-policy.json";

    private final RoleRepository roleRepository;
    private final PermissionRepository permissionRepository;
    private final RolePermissionRepository rolePermissionRepository;
    private final ObjectMapper objectMapper;

    public record PolicyManifest(String version, List<PermissionEntry> permissions, List<RoleEntry> roles) {
    }

    public record PermissionEntry(String name, String scope, String description) {
    }

    /**
     * @param permissions grants written as {@code Name:Scope}
     */
    public record RoleEntry(String name, String description, List<String> permissions) {
    }

    @Override
    public SeedResult seed() {
        PolicyManifest manifest = loadManifest();
        log.info("Seeding default access policy version {}", manifest.version());

        int permissionsCreated = 0;
        Map<String, Permission> permissions = new HashMap<>();
        for (PermissionEntry entry : manifest.permissions()) {
            ScopeType scope = ScopeType.fromValue(entry.scope());
            Permission permission = permissionRepository.findByNameAndScope(entry.name(), scope).orElse(null);
            if (permission == null) {
                permission = permissionRepository.save(Permission.builder()
                        .name(entry.name())
                        .scope(scope)
                        .description(entry.description())
                        .build());
                permissionsCreated++;
            }
            permissions.put(grantKey(entry.name(), scope), permission);
        }

        int rolesCreated = 0;
        int mappingsCreated = 0;
        for (RoleEntry entry : manifest.roles()) {
            Role role = roleRepository.findByName(entry.name()).orElse(null);
            if (role == null) {
                role = roleRepository.save(Role.builder()
                        .name(entry.name())
                        .description(entry.description())
                        .isSystemRole(true)
                        .build());
                rolesCreated++;
            }

            for (String grant : entry.permissions()) {
                Permission permission = permissions.get(normalizeGrant(grant));
                if (permission == null) {
                    throw new IllegalStateException("Role " + entry.name() + " references unknown permission " + grant);
                }
                if (!rolePermissionRepository.existsByRole_IdAndPermission_Id(role.getId(), permission.getId())) {
                    rolePermissionRepository.save(RolePermission.builder()
                            .role(role)
                            .permission(permission)
                            .build());
                    mappingsCreated++;
                }
            }
        }

        SeedResult result = new SeedResult(permissionsCreated, rolesCreated, mappingsCreated);
        if (result.changed()) {
            log.info("Seeded {} permissions, {} roles and {} role-permission mappings",
                    permissionsCreated, rolesCreated, mappingsCreated);
        } else {
            log.debug("Default access policy already present");
        }
        return result;
    }

    private PolicyManifest loadManifest() {
        try (InputStream in = new ClassPathResource(POLICY_PATH).getInputStream()) {
            return objectMapper.readValue(in, PolicyManifest.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load policy from " + POLICY_PATH, e);
        }
    }

    private static String normalizeGrant(String grant) {
        String[] parts = grant.split(":", 2);
        if (parts.length != 2) {
            throw new IllegalStateException("Malformed grant in policy: " + grant);
        }
        return grantKey(parts[0].trim(), ScopeType.fromValue(parts[1]));
    }

    private static String grantKey(String name, ScopeType scope) {
        return name + ":" + scope.name();
    }
}
