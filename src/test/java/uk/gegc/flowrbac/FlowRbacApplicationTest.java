package uk.gegc.flowrbac;

import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;

import static org.assertj.core.api.Assertions.assertThat;

class FlowRbacApplicationTest extends BaseIntegrationTest {

    @Autowired
    private MeterRegistry meterRegistry;

    @Autowired
    private Environment environment;

    @Test
    @DisplayName("context exposes access-control meters without any web endpoint settings")
    void contextLoads_withAccessControlMeters() {
        assertThat(meterRegistry.find("rbac.checks.granted").counter()).isNotNull();
        assertThat(meterRegistry.find("rbac.batch.latency").timer()).isNotNull();
        assertThat(environment.containsProperty("management.endpoints.web.exposure.include")).isFalse();
    }
}
