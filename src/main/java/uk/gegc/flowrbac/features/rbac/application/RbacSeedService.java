package uk.gegc.flowrbac.features.rbac.application;

/**
 * Creates the default permissions, system roles and their mappings from the bundled policy.
 */
public interface RbacSeedService {

    /**
     * Adds whatever part of the default policy is missing. Running it again changes nothing.
     *
     * @return counts of rows created by this run
     */
    SeedResult seed();

    /**
     * Result of a seeding run.
     */
    record SeedResult(int permissionsCreated, int rolesCreated, int mappingsCreated) {

        public boolean changed() {
            return permissionsCreated + rolesCreated + mappingsCreated > 0;
        }
    }
}
