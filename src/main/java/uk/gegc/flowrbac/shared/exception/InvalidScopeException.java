package uk.gegc.flowrbac.shared.exception;

public class InvalidScopeException extends RbacException {

    public InvalidScopeException(String message) {
        super(ErrorKind.INVALID_SCOPE, message);
    }
}
