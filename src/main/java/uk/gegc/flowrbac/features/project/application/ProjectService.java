package uk.gegc.flowrbac.features.project.application;

import uk.gegc.flowrbac.features.project.api.dto.ProjectDto;

import java.util.UUID;

/**
 * Project workflows. Every operation on an existing project checks the caller's permission
 * before checking that the project exists.
 */
public interface ProjectService {

    /**
     * Creates the project and makes the caller its Owner in one transaction.
     */
    ProjectDto createProject(UUID userId, String name);

    ProjectDto getProject(UUID userId, UUID projectId);

    ProjectDto renameProject(UUID userId, UUID projectId, String name);

    /**
     * Deletes the project, its flows and every assignment scoped to any of them.
     */
    void deleteProject(UUID userId, UUID projectId);
}
