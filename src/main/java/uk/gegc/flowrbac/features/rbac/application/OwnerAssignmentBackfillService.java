package uk.gegc.flowrbac.features.rbac.application;

/**
 * Grants the Owner role on resources that predate role assignments.
 */
public interface OwnerAssignmentBackfillService {

    /**
     * Idempotent: a resource whose owner already holds the Owner role on it is left alone.
     */
    BackfillResult backfill();

    record BackfillResult(
            int starterProjectsMarked,
            int projectAssignmentsCreated,
            int flowAssignmentsCreated,
            int skipped
    ) {
    }
}
