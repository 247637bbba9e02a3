package uk.gegc.flowrbac.shared.exception;

public class ForbiddenException extends RbacException {

    public ForbiddenException(String message) {
        super(ErrorKind.FORBIDDEN, message);
    }
}
