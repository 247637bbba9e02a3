package uk.gegc.flowrbac.features.rbac.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.flowrbac.features.rbac.application.BypassPolicy;
import uk.gegc.flowrbac.features.rbac.application.RbacMetricsService;

import java.time.Duration;
import java.util.List;

/**
 * Micrometer-backed access-control metrics.
 */
@Slf4j
@Service
public class RbacMetricsServiceImpl implements RbacMetricsService {

    private final Counter checksGrantedCounter;
    private final Counter checksDeniedCounter;
    private final Counter checksBypassCounter;
    private final Counter assignmentCreatedCounter;
    private final Counter assignmentUpdatedCounter;
    private final Counter assignmentRemovedCounter;

    private final Timer batchLatencyTimer;

    public RbacMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.checksGrantedCounter = Counter.builder("rbac.checks.granted")
                .description("Number of permission checks that were granted")
                .register(meterRegistry);
        this.checksDeniedCounter = Counter.builder("rbac.checks.denied")
                .description("Number of permission checks that were denied")
                .register(meterRegistry);
        this.checksBypassCounter = Counter.builder("rbac.checks.bypass")
                .description("Number of permission checks granted by superuser or global admin")
                .register(meterRegistry);
        this.assignmentCreatedCounter = Counter.builder("rbac.assignments.created")
                .description("Number of role assignments created")
                .register(meterRegistry);
        this.assignmentUpdatedCounter = Counter.builder("rbac.assignments.updated")
                .description("Number of role assignments updated")
                .register(meterRegistry);
        this.assignmentRemovedCounter = Counter.builder("rbac.assignments.removed")
                .description("Number of role assignments removed")
                .register(meterRegistry);

        this.batchLatencyTimer = Timer.builder("rbac.batch.latency")
                .description("Latency of batch permission checks")
                .register(meterRegistry);
    }

    @Override
    public void recordDecision(boolean granted) {
        (granted ? checksGrantedCounter : checksDeniedCounter).increment();
    }

    @Override
    public void recordDecisions(List<Boolean> results) {
        long granted = results.stream().filter(Boolean::booleanValue).count();
        checksGrantedCounter.increment(granted);
        checksDeniedCounter.increment(results.size() - granted);
    }

    @Override
    public void recordBypass(BypassPolicy.Bypass bypass, int checks) {
        checksBypassCounter.increment(checks);
        checksGrantedCounter.increment(checks);
        log.debug("{} bypass granted {} check(s)", bypass, checks);
    }

    @Override
    public void recordBatchLatency(Duration latency, int checks) {
        batchLatencyTimer.record(latency);
        log.debug("Batch of {} check(s) resolved in {} ms", checks, latency.toMillis());
    }

    @Override
    public void incrementAssignmentCreated() {
        assignmentCreatedCounter.increment();
    }

    @Override
    public void incrementAssignmentUpdated() {
        assignmentUpdatedCounter.increment();
    }

    @Override
    public void incrementAssignmentRemoved(int count) {
        assignmentRemovedCounter.increment(count);
    }
}
