package uk.gegc.flowrbac.shared.exception;

import java.util.UUID;

public class UserNotFoundException extends RbacException {

    private final UUID userId;

    public UserNotFoundException(UUID userId) {
        super(ErrorKind.USER_NOT_FOUND, String.format("User with ID %s not found", userId));
        this.userId = userId;
    }

    public UUID getUserId() {
        return userId;
    }
}
