package uk.gegc.flowrbac.shared.exception;

public class ValidationException extends RbacException {

    public ValidationException(String message) {
        super(ErrorKind.VALIDATION_FAILED, message);
    }

    public ValidationException(String message, Throwable cause) {
        super(ErrorKind.VALIDATION_FAILED, message, cause);
    }
}
