package uk.gegc.flowrbac.shared.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.flowrbac.features.rbac.application.BypassPolicy;
import uk.gegc.flowrbac.features.rbac.application.PermissionChecker;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.exception.ErrorKind;
import uk.gegc.flowrbac.shared.exception.ForbiddenException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScopeAccessPolicyTest {

    @Mock
    private PermissionChecker permissionChecker;

    @Mock
    private BypassPolicy bypassPolicy;

    @InjectMocks
    private ScopeAccessPolicy accessPolicy;

    @Test
    @DisplayName("requirePermission: when granted then passes")
    void requirePermission_whenGranted_thenPasses() {
        UUID userId = UUID.randomUUID();
        UUID flowId = UUID.randomUUID();
        when(permissionChecker.canAccess(userId, "Read", ScopeType.FLOW, flowId)).thenReturn(true);

        assertThatCode(() -> accessPolicy.requirePermission(userId, "Read", ScopeType.FLOW, flowId))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("requirePermission: when denied then throws Forbidden")
    void requirePermission_whenDenied_thenForbidden() {
        UUID userId = UUID.randomUUID();
        UUID projectId = UUID.randomUUID();
        when(permissionChecker.canAccess(userId, "Delete", ScopeType.PROJECT, projectId)).thenReturn(false);

        assertThatThrownBy(() -> accessPolicy.requirePermission(userId, "Delete", ScopeType.PROJECT, projectId))
                .isInstanceOfSatisfying(ForbiddenException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.FORBIDDEN));
    }

    @Test
    @DisplayName("requirePermission: when caller unknown then throws Forbidden without checking")
    void requirePermission_whenNoCaller_thenForbidden() {
        assertThatThrownBy(() -> accessPolicy.requirePermission(null, "Read", ScopeType.GLOBAL, null))
                .isInstanceOf(ForbiddenException.class);
        verifyNoInteractions(permissionChecker);
    }

    @Test
    @DisplayName("requireAdmin: only bypass holders pass")
    void requireAdmin_onlyBypassHoldersPass() {
        UUID adminId = UUID.randomUUID();
        UUID userId = UUID.randomUUID();
        when(bypassPolicy.evaluate(adminId)).thenReturn(BypassPolicy.Bypass.GLOBAL_ADMIN);
        when(bypassPolicy.evaluate(userId)).thenReturn(BypassPolicy.Bypass.NONE);

        assertThatCode(() -> accessPolicy.requireAdmin(adminId)).doesNotThrowAnyException();
        assertThatThrownBy(() -> accessPolicy.requireAdmin(userId)).isInstanceOf(ForbiddenException.class);
        assertThat(accessPolicy.isAdmin(null)).isFalse();
    }
}
