package uk.gegc.flowrbac.shared.exception;

/**
 * Stable catalog of access-control error kinds.
 * <p>
 * A boundary layer maps each kind to its outcome without depending on the
 * concrete exception classes: the not-found kinds map to 404, {@link #INVALID_SCOPE}
 * and {@link #IMMUTABLE_ASSIGNMENT} to 400, {@link #DUPLICATE_ASSIGNMENT} to 409,
 * {@link #FORBIDDEN} to 403 and {@link #VALIDATION_FAILED} to 422.
 */
public enum ErrorKind {

    // ==================== Lookup Errors ====================
    USER_NOT_FOUND,
    ROLE_NOT_FOUND,
    RESOURCE_NOT_FOUND,
    ASSIGNMENT_NOT_FOUND,

    // ==================== Request Errors ====================
    INVALID_SCOPE,
    VALIDATION_FAILED,

    // ==================== State Errors ====================
    DUPLICATE_ASSIGNMENT,
    IMMUTABLE_ASSIGNMENT,

    // ==================== Access Errors ====================
    FORBIDDEN
}
