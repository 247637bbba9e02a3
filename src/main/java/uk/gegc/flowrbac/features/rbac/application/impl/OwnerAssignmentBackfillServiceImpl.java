package uk.gegc.flowrbac.features.rbac.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;
import uk.gegc.flowrbac.features.flow.domain.repository.FlowRepository;
import uk.gegc.flowrbac.features.project.domain.model.Project;
import uk.gegc.flowrbac.features.project.domain.repository.ProjectRepository;
import uk.gegc.flowrbac.features.rbac.application.AssignmentManager;
import uk.gegc.flowrbac.features.rbac.application.OwnerAssignmentBackfillService;
import uk.gegc.flowrbac.features.rbac.application.store.PermissionStore;
import uk.gegc.flowrbac.features.rbac.application.store.RoleRecord;
import uk.gegc.flowrbac.features.rbac.application.store.ScopeRef;
import uk.gegc.flowrbac.features.rbac.domain.model.ScopeType;
import uk.gegc.flowrbac.shared.config.RbacProperties;
import uk.gegc.flowrbac.shared.exception.RoleNotFoundException;

import java.util.List;
import java.util.UUID;

/**
 * Starter projects (the shared folder without an owning user) are flagged first so that
 * owner assignments on them come out immutable. Flows inside a project get no assignment
 * of their own since they inherit from the project.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class OwnerAssignmentBackfillServiceImpl implements OwnerAssignmentBackfillService {

    private final ProjectRepository projectRepository;
    private final FlowRepository flowRepository;
    private final PermissionStore store;
    private final AssignmentManager assignmentManager;
    private final RbacProperties properties;

    @Override
    public BackfillResult backfill() {
        log.info("Starting owner assignment backfill");
        RoleRecord owner = store.findRoleByName(properties.getOwnerRoleName())
                .orElseThrow(() -> new RoleNotFoundException(properties.getOwnerRoleName()));

        int starterProjectsMarked = markStarterProjects();

        int projectAssignments = 0;
        int flowAssignments = 0;
        int skipped = 0;

        for (Project project : projectRepository.findByUserIdIsNotNull()) {
            if (grantOwner(owner, project.getUserId(), ScopeType.PROJECT, project.getId(), project.isStarterProject())) {
                projectAssignments++;
            } else {
                skipped++;
            }
        }

        for (Flow flow : flowRepository.findByUserIdIsNotNullAndFolderIdIsNull()) {
            if (grantOwner(owner, flow.getUserId(), ScopeType.FLOW, flow.getId(), false)) {
                flowAssignments++;
            } else {
                skipped++;
            }
        }

        log.info("Owner backfill completed: {} starter project(s) marked, {} project and {} flow assignment(s) created, {} skipped",
                starterProjectsMarked, projectAssignments, flowAssignments, skipped);
        return new BackfillResult(starterProjectsMarked, projectAssignments, flowAssignments, skipped);
    }

    private int markStarterProjects() {
        List<Project> starters = projectRepository.findByNameAndUserIdIsNull(properties.getStarterProjectName());
        int marked = 0;
        for (Project project : starters) {
            if (!project.isStarterProject()) {
                project.setStarterProject(true);
                marked++;
            }
        }
        return marked;
    }

    private boolean grantOwner(RoleRecord owner, UUID userId, ScopeType scopeType, UUID scopeId, boolean immutable) {
        if (store.findUser(userId).isEmpty()) {
            log.warn("Skipping {} {}: owning user {} does not exist", scopeType, scopeId, userId);
            return false;
        }
        if (store.findAssignment(userId, owner.id(), ScopeRef.of(scopeType, scopeId)).isPresent()) {
            return false;
        }
        assignmentManager.assignRole(userId, owner.name(), scopeType, scopeId, null, immutable);
        return true;
    }
}
