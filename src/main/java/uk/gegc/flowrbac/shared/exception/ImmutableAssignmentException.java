package uk.gegc.flowrbac.shared.exception;

/**
 * Raised when a protected assignment is targeted by a remove or modify operation.
 */
public class ImmutableAssignmentException extends RbacException {

    public static final String OPERATION_REMOVE = "remove";
    public static final String OPERATION_MODIFY = "modify";

    private final String operation;

    public ImmutableAssignmentException(String operation) {
        super(ErrorKind.IMMUTABLE_ASSIGNMENT, String.format("Cannot %s immutable role assignment", operation));
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
