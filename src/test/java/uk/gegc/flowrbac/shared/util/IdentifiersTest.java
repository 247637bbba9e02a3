package uk.gegc.flowrbac.shared.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uk.gegc.flowrbac.shared.exception.ValidationException;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IdentifiersTest {

    @Test
    @DisplayName("parseRequired trims and parses a UUID")
    void parseRequired_parsesTrimmedValue() {
        UUID id = UUID.randomUUID();

        assertThat(Identifiers.parseRequired(" " + id + " ", "user_id")).isEqualTo(id);
    }

    @Test
    @DisplayName("parseRequired rejects blank and malformed values naming the field")
    void parseRequired_rejectsBlankAndMalformed() {
        assertThatThrownBy(() -> Identifiers.parseRequired("", "user_id"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("user_id");
        assertThatThrownBy(() -> Identifiers.parseRequired("abc", "scope_id"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("scope_id");
    }

    @Test
    @DisplayName("parseOptional maps blank to null")
    void parseOptional_blankIsNull() {
        assertThat(Identifiers.parseOptional(null, "scope_id")).isNull();
        assertThat(Identifiers.parseOptional("  ", "scope_id")).isNull();
    }
}
