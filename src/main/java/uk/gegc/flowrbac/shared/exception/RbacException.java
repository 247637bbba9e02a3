package uk.gegc.flowrbac.shared.exception;

/**
 * Base type for the expected, recoverable access-control failures.
 * Store outages are not modelled here and propagate as {@code DataAccessException}.
 */
public abstract class RbacException extends RuntimeException {

    private final ErrorKind kind;

    protected RbacException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected RbacException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
