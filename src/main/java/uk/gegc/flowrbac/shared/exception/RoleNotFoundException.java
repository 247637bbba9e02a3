package uk.gegc.flowrbac.shared.exception;

public class RoleNotFoundException extends RbacException {

    private final String roleName;

    public RoleNotFoundException(String roleName) {
        super(ErrorKind.ROLE_NOT_FOUND, String.format("Role '%s' not found", roleName));
        this.roleName = roleName;
    }

    public String getRoleName() {
        return roleName;
    }
}
