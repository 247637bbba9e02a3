package uk.gegc.flowrbac.shared.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration for role resolution and policy bootstrap.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "rbac")
public class RbacProperties {

    /**
     * Role whose Global assignment bypasses every check.
     */
    @NotBlank
    private String adminRoleName = "Admin";

    /**
     * Role granted to the creator of a Project or Flow.
     */
    @NotBlank
    private String ownerRoleName = "Owner";

    /**
     * Name of the shared starter folder whose owner assignments are immutable.
     */
    @NotBlank
    private String starterProjectName = "Starter Projects";

    @Valid
    private Batch batch = new Batch();

    @Valid
    private Seed seed = new Seed();

    @Valid
    private Backfill backfill = new Backfill();

    @Data
    public static class Batch {

        @Min(1)
        @Max(100)
        private int maxChecks = 100;
    }

    @Data
    public static class Seed {

        private boolean enabled = true;
    }

    @Data
    public static class Backfill {

        private boolean enabled = false;
    }
}
