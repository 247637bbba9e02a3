package uk.gegc.flowrbac.shared.util;

import uk.gegc.flowrbac.shared.exception.ValidationException;

import java.util.UUID;

/**
 * Parsing helpers for identifiers arriving as text.
 */
public final class Identifiers {

    private Identifiers() {
    }

    public static UUID parseRequired(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(field + " is required");
        }
        return parse(value, field);
    }

    /**
     * Returns {@code null} for a null or blank value, otherwise the parsed UUID.
     */
    public static UUID parseOptional(String value, String field) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return parse(value, field);
    }

    private static UUID parse(String value, String field) {
        try {
            return UUID.fromString(value.trim());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(String.format("%s is not a valid identifier: '%s'", field, value), e);
        }
    }
}
