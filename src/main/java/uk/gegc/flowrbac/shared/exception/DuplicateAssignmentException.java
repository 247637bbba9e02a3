package uk.gegc.flowrbac.shared.exception;

public class DuplicateAssignmentException extends RbacException {

    private static final String DEFAULT_MESSAGE = "Role assignment already exists for this user, role and scope";

    public DuplicateAssignmentException() {
        super(ErrorKind.DUPLICATE_ASSIGNMENT, DEFAULT_MESSAGE);
    }

    public DuplicateAssignmentException(Throwable cause) {
        super(ErrorKind.DUPLICATE_ASSIGNMENT, DEFAULT_MESSAGE, cause);
    }
}
