package uk.gegc.flowrbac.shared.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;
import uk.gegc.flowrbac.features.rbac.application.OwnerAssignmentBackfillService;
import uk.gegc.flowrbac.features.rbac.application.RbacSeedService;

@Component
@RequiredArgsConstructor
@Slf4j
public class RbacDataInitializer implements CommandLineRunner {

    private final RbacSeedService seedService;
    private final OwnerAssignmentBackfillService backfillService;
    private final RbacProperties properties;

    @Override
    public void run(String... args) throws Exception {
        log.info("Starting access-control data initialization...");

        try {
            if (properties.getSeed().isEnabled()) {
                seedService.seed();
            } else {
                log.info("Default policy seeding disabled");
            }
            if (properties.getBackfill().isEnabled()) {
                backfillService.backfill();
            }
            log.info("Access-control data initialization completed successfully");
        } catch (Exception e) {
            log.error("Error during access-control data initialization: {}", e.getMessage(), e);
            throw e;
        }
    }
}
