package uk.gegc.flowrbac.features.flow.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.flow.api.dto.FlowDto;
import uk.gegc.flowrbac.features.flow.application.FlowService;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;
import uk.gegc.flowrbac.features.flow.domain.repository.FlowRepository;
import uk.gegc.flowrbac.features.flow.infra.mapping.FlowMapper;
import uk.gegc.flowrbac.features.project.domain.repository.ProjectRepository;
import uk.gegc.flowrbac.features.rbac.application.AssignmentManager;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.features.user.domain.repository.UserRepository;
import uk.gegc.flowrbac.shared.config.RbacProperties;
import uk.gegc.flowrbac.shared.exception.ResourceNotFoundException;
import uk.gegc.flowrbac.shared.exception.UserNotFoundException;
import uk.gegc.flowrbac.shared.exception.ValidationException;
import uk.gegc.flowrbac.shared.security.annotation.RequireScopePermission;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class FlowServiceImpl implements FlowService {

    private static final String RESOURCE_KIND = "Flow";

    private final FlowRepository flowRepository;
    private final ProjectRepository projectRepository;
    private final UserRepository userRepository;
    private final AssignmentManager assignmentManager;
    private final FlowMapper flowMapper;
    private final RbacProperties properties;

    @Override
    @RequireScopePermission(permission = "Create", scope = ScopeType.PROJECT, scopeParam = "projectId", optional = true)
    public FlowDto createFlow(UUID userId, String name, UUID projectId) {
        requireName(name);
        if (userId == null || !userRepository.existsById(userId)) {
            throw new UserNotFoundException(userId);
        }
        if (projectId != null && !projectRepository.existsById(projectId)) {
            throw new ResourceNotFoundException("Project", projectId);
        }

        Flow flow = flowRepository.save(Flow.builder()
                .name(name.trim())
                .userId(userId)
                .folderId(projectId)
                .build());
        assignmentManager.assignRole(userId, properties.getOwnerRoleName(), ScopeType.FLOW, flow.getId(), userId);

        log.info("User {} created flow {} in {}", userId, flow.getId(), projectId != null ? projectId : "no project");
        return flowMapper.toDto(flow);
    }

    @Override
    @Transactional(readOnly = true)
    @RequireScopePermission(permission = "Read", scope = ScopeType.FLOW, scopeParam = "flowId")
    public FlowDto getFlow(UUID userId, UUID flowId) {
        return flowMapper.toDto(requireFlow(flowId));
    }

    @Override
    @RequireScopePermission(permission = "Update", scope = ScopeType.FLOW, scopeParam = "flowId")
    public FlowDto renameFlow(UUID userId, UUID flowId, String name) {
        requireName(name);
        Flow flow = requireFlow(flowId);
        flow.setName(name.trim());
        log.info("User {} renamed flow {} to {}", userId, flowId, flow.getName());
        return flowMapper.toDto(flow);
    }

    @Override
    @RequireScopePermission(permission = "Delete", scope = ScopeType.FLOW, scopeParam = "flowId")
    public void deleteFlow(UUID userId, UUID flowId) {
        if (!flowRepository.existsById(flowId)) {
            throw new ResourceNotFoundException(RESOURCE_KIND, flowId);
        }
        assignmentManager.removeAssignmentsForScope(ScopeType.FLOW, flowId);
        flowRepository.deleteById(flowId);
        log.info("User {} deleted flow {}", userId, flowId);
    }

    private Flow requireFlow(UUID flowId) {
        return flowRepository.findById(flowId)
                .orElseThrow(() -> new ResourceNotFoundException(RESOURCE_KIND, flowId));
    }

    private void requireName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException("Flow name is required");
        }
    }
}
