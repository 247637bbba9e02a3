package uk.gegc.flowrbac.shared.exception;

import java.util.UUID;

/**
 * A Project or Flow referenced by id does not exist.
 */
public class ResourceNotFoundException extends RbacException {

    private final String resourceKind;
    private final UUID resourceId;

    public ResourceNotFoundException(String resourceKind, UUID resourceId) {
        super(ErrorKind.RESOURCE_NOT_FOUND, String.format("%s with ID %s not found", resourceKind, resourceId));
        this.resourceKind = resourceKind;
        this.resourceId = resourceId;
    }

    public String getResourceKind() {
        return resourceKind;
    }

    public UUID getResourceId() {
        return resourceId;
    }
}
