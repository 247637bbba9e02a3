package uk.gegc.flowrbac.features.rbac.domain.event;

import org.springframework.context.ApplicationEvent;
import uk.gegc.flowrbac.features.rbac.application.store.AssignmentRecord;
import uk.gegc.flowrbac.features.rbac.domain.model.RoleAssignmentAudit;

import java.time.Instant;
import java.util.UUID;

/**
 * Domain event published after a role assignment has been created, changed or removed.
 * <p>
 * Observers run once the surrounding transaction commits, so the assignment write never
 * depends on them.
 * </p>
 */
public class RoleAssignmentChangedEvent extends ApplicationEvent {

    private final RoleAssignmentAudit.AuditAction action;
    private final AssignmentRecord before;
    private final AssignmentRecord after;
    private final UUID actorId;
    private final Instant occurredAt;

    public RoleAssignmentChangedEvent(Object source,
                                      RoleAssignmentAudit.AuditAction action,
                                      AssignmentRecord before,
                                      AssignmentRecord after,
                                      UUID actorId,
                                      Instant occurredAt) {
        super(source);
        if (before == null && after == null) {
            throw new IllegalArgumentException("Either the before or the after state is required");
        }
        this.action = action;
        this.before = before;
        this.after = after;
        this.actorId = actorId;
        this.occurredAt = occurredAt;
    }

    public static RoleAssignmentChangedEvent assigned(Object source, AssignmentRecord created, UUID actorId, Instant at) {
        return new RoleAssignmentChangedEvent(source, RoleAssignmentAudit.AuditAction.ROLE_ASSIGNED, null, created, actorId, at);
    }

    public static RoleAssignmentChangedEvent updated(Object source, AssignmentRecord before, AssignmentRecord after,
                                                     UUID actorId, Instant at) {
        return new RoleAssignmentChangedEvent(source, RoleAssignmentAudit.AuditAction.ROLE_UPDATED, before, after, actorId, at);
    }

    public static RoleAssignmentChangedEvent removed(Object source, AssignmentRecord removed, UUID actorId, Instant at) {
        return new RoleAssignmentChangedEvent(source, RoleAssignmentAudit.AuditAction.ROLE_REMOVED, removed, null, actorId, at);
    }

    public RoleAssignmentAudit.AuditAction getAction() {
        return action;
    }

    /**
     * @return null for a newly created assignment
     */
    public AssignmentRecord getBefore() {
        return before;
    }

    /**
     * @return null for a removed assignment
     */
    public AssignmentRecord getAfter() {
        return after;
    }

    /**
     * The state that identifies the assignment: the after state, or the before state once removed.
     */
    public AssignmentRecord getSubject() {
        return after != null ? after : before;
    }

    public UUID getActorId() {
        return actorId;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }
}
