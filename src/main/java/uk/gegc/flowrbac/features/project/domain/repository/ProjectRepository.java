package uk.gegc.flowrbac.features.project.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.project.domain.model.Project;

import java.util.List;
import java.util.UUID;

@Repository
public interface ProjectRepository extends JpaRepository<Project, UUID> {

    List<Project> findByUserIdIsNotNull();

    List<Project> findByNameAndUserIdIsNull(String name);
}
