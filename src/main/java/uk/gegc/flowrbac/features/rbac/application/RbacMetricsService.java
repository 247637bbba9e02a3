package uk.gegc.flowrbac.features.rbac.application;

import java.time.Duration;
import java.util.List;

/**
 * Service for emitting access-control metrics.
 */
public interface RbacMetricsService {

    void recordDecision(boolean granted);

    void recordDecisions(List<Boolean> results);

    void recordBypass(BypassPolicy.Bypass bypass, int checks);

    void recordBatchLatency(Duration latency, int checks);

    void incrementAssignmentCreated();

    void incrementAssignmentUpdated();

    void incrementAssignmentRemoved(int count);
}
