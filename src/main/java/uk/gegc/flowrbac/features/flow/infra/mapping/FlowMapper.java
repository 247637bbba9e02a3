package uk.gegc.flowrbac.features.flow.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.flow.api.dto.FlowDto;
import uk.gegc.flowrbac.features.flow.domain.model.Flow;

@Component
public class FlowMapper {

    public FlowDto toDto(Flow flow) {
        return new FlowDto(
                flow.getId(),
                flow.getName(),
                flow.getUserId(),
                flow.getFolderId(),
                flow.getCreatedAt()
        );
    }
}
