package uk.gegc.flowrbac.features.flow.domain.repository;

import java.util.UUID;

/**
 * Projection of a flow onto its parent project.
 */
public record FlowParent(UUID flowId, UUID projectId) {
}
