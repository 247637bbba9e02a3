package uk.gegc.flowrbac.shared.exception;

import java.util.UUID;

public class AssignmentNotFoundException extends RbacException {

    private final UUID assignmentId;

    public AssignmentNotFoundException(UUID assignmentId) {
        super(ErrorKind.ASSIGNMENT_NOT_FOUND, String.format("Role assignment with ID %s not found", assignmentId));
        this.assignmentId = assignmentId;
    }

    public UUID getAssignmentId() {
        return assignmentId;
    }
}
