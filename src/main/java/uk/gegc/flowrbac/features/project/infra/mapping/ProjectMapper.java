package uk.gegc.flowrbac.features.project.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.project.api.dto.ProjectDto;
import uk.gegc.flowrbac.features.project.domain.model.Project;

@Component
public class ProjectMapper {

    public ProjectDto toDto(Project project) {
        return new ProjectDto(
                project.getId(),
                project.getName(),
                project.getUserId(),
                project.isStarterProject(),
                project.getCreatedAt()
        );
    }
}
