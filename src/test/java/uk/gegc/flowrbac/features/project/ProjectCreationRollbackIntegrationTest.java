package uk.gegc.flowrbac.features.project;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.BaseIntegrationTest;
import uk.gegc.flowrbac.features.project.application.ProjectService;
import uk.gegc.flowrbac.features.project.domain.repository.ProjectRepository;
import uk.gegc.flowrbac.shared.exception.RoleNotFoundException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs outside a test transaction so that the service's own rollback is observable.
 */
@Transactional(propagation = Propagation.NOT_SUPPORTED)
@TestPropertySource(properties = "rbac.owner-role-name=Missing")
class ProjectCreationRollbackIntegrationTest extends BaseIntegrationTest {

    @Autowired
    private ProjectService projectService;

    @Autowired
    private ProjectRepository projectRepository;

    @AfterEach
    void cleanUp() {
        projectRepository.deleteAll();
        userRepository.deleteAll();
    }

    @Test
    @DisplayName("When the owner assignment fails no project is left behind")
    void createProject_whenOwnerAssignmentFails_thenProjectRolledBack() {
        UUID userId = createUser("creator");

        assertThatThrownBy(() -> projectService.createProject(userId, "Doomed"))
                .isInstanceOf(RoleNotFoundException.class);

        assertThat(projectRepository.count()).isZero();
    }
}
