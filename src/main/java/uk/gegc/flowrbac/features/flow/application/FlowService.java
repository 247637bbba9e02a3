package uk.gegc.flowrbac.features.flow.application;

import uk.gegc.flowrbac.features.flow.api.dto.FlowDto;

import java.util.UUID;

public interface FlowService {

    /**
     * Creating inside a project requires Create on that project. The caller becomes Owner of the flow.
     *
     * @param projectId null for a standalone flow
     */
    FlowDto createFlow(UUID userId, String name, UUID projectId);

    FlowDto getFlow(UUID userId, UUID flowId);

    FlowDto renameFlow(UUID userId, UUID flowId, String name);

    void deleteFlow(UUID userId, UUID flowId);
}
