package uk.gegc.flowrbac.features.flow.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;

import java.util.Collection;
import java.util.List;
import java.util.UUID;

@Repository
public interface FlowRepository extends JpaRepository<Flow, UUID> {

    List<Flow> findByFolderId(UUID folderId);

    List<Flow> findByUserIdIsNotNullAndFolderIdIsNull();

    /**
     * Parent projects of the given flows in one query. Standalone and unknown flows are omitted.
     */
    @Query("SELECT new uk.gegc.flowrbac.features.flow.domain.repository.FlowParent(f.id, f.folderId) " +
           "FROM Flow f WHERE f.id IN :flowIds AND f.folderId IS NOT NULL")
    List<FlowParent> findParents(@Param("flowIds") Collection<UUID> flowIds);
}
