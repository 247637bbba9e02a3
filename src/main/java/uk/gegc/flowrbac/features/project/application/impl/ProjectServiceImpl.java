package uk.gegc.flowrbac.features.project.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;
import uk.gegc.flowrbac.features.flow.domain.repository.FlowRepository;
import uk.gegc.flowrbac.features.project.api.dto.ProjectDto;
import uk.gegc.flowrbac.features.project.application.ProjectService;
import uk.gegc.flowrbac.features.project.domain.model.Project;
import uk.gegc.flowrbac.features.project.domain.repository.ProjectRepository;
import uk.gegc.flowrbac.features.project.infra.mapping.ProjectMapper;
import uk.gegc.flowrbac.features.rbac.application.AssignmentManager;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.user.domain.repository.UserRepository;
import uk.gegc.flowrbac.shared.config.RbacProperties;
import uk.gegc.flowrbac.shared.exception.ResourceNotFoundException;
import uk.gegc.flowrbac.shared.exception.UserNotFoundException;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.security.annotation.RequireScopePermission;

import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class ProjectServiceImpl implements ProjectService {

    private static final String RESOURCE_KIND = "Project";

    private final ProjectRepository projectRepository;
    private final FlowRepository flowRepository;
    private final UserRepository userRepository;
    private final AssignmentManager assignmentManager;
    private final ProjectMapper projectMapper;
    private final RbacProperties properties;

    @Override
    public ProjectDto createProject(UUID userId, String name) {
        requireName(name);
        if (userId == null || !userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }

        Project project = projectRepository.save(Project.builder()
                .name(name.trim())
                .userId(userId)
                .build());
        assignmentManager.assignRole(userId, properties.getOwnerRoleName(), ScopeType.PROJECT, project.getId(), userId);

        log.info("User {} created project {} ({})", userId, project.getId(), project.getName());
        return projectMapper.toDto(project);
    }

    @Override
    @Transactional(readOnly = true)
    @RequireScopePermission(permission = "Read", scope = ScopeType.PROJECT, scopeParam = "projectId")
    public ProjectDto getProject(UUID userId, UUID projectId) {
        return projectMapper.toDto(requireProject(projectId));
    }

    @Override
    @RequireScopePermission(permission = "Update", scope = ScopeType.PROJECT, scopeParam = "projectId")
    public ProjectDto renameProject(UUID userId, UUID projectId, String name) {
        requireName(name);
        Project project = requireProject(projectId);
        project.setName(name.trim());
        log.info("User {} renamed project {} to {}", userId, projectId, project.getName());
        return projectMapper.toDto(project);
    }

    @Override
    @RequireScopePermission(permission = "Delete", scope = ScopeType.PROJECT, scopeParam = "projectId")
    public void deleteProject(UUID userId, UUID projectId) {
        if (!projectRepository.existsById(projectId)) {
            throw new ResourceNotFoundException(RESOURCE_KIND, projectId);
        }

        List<UUID> flowIds = flowRepository.findByFolderId(projectId).stream()
                .map(Flow::getId)
                .toList();
        for (UUID flowId : flowIds) {
            assignmentManager.removeAssignmentsForScope(ScopeType.FLOW, flowId);
        }
        if (!flowIds.isEmpty()) {
            flowRepository.deleteAllByIdInBatch(flowIds);
        }

        assignmentManager.removeAssignmentsForScope(ScopeType.PROJECT, projectId);
        projectRepository.deleteById(projectId);
        log.info("User {} deleted project {} with {} flow(s)", userId, projectId, flowIds.size());
    }

    private Project requireProject(UUID projectId) {
        return projectRepository.findById(projectId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_KIND, projectId));
    }

    private void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Project name is required");
        }
    }
}
