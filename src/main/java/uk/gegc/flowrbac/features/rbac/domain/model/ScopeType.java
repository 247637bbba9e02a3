package uk.gegc.flowrbac.features.rbac.domain.model;

import uk.gegc.flowrbac.shared.exception.InvalidScopeException;

import java.util.Arrays;

/**
 * Kind of resource an authorization statement applies to.
 */
public enum ScopeType {
    GLOBAL("Global"),
    PROJECT("Project"),
    FLOW("Flow");

    private final String value;

    ScopeType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Whether assignments at this scope must reference a concrete resource.
     */
    public boolean requiresScopeId() {
        return this != GLOBAL;
    }

    /**
     * Resolves a scope from its display value ("Flow") or constant name ("FLOW"), case-insensitively.
     */
    public static ScopeType fromValue(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidScopeException("scope_type is required");
        }
        String candidate = value.trim();
        return Arrays.stream(values())
                .filter(type -> type.value.equalsIgnoreCase(candidate) || type.name().equalsIgnoreCase(candidate))
                .findFirst()
                .orElseThrow(() -> new InvalidScopeException(
                        String.format("Invalid scope_type: %s. Must be 'Flow', 'Project', or 'Global'", value)));
    }

    @Override
    public String toString() {
        return value;
    }
}
