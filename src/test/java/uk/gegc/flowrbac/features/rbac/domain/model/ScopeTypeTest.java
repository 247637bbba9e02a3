package uk.gegc.flowrbac.features.rbac.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;
import uk.gegc.flowrbac.shared.exception.InvalidScopeException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScopeTypeTest {

    @ParameterizedTest
    @CsvSource({
            "Flow, FLOW",
            "flow, FLOW",
            "PROJECT, PROJECT",
            "' Global ', GLOBAL"
    })
    @DisplayName("fromValue accepts display values and constant names in any case")
    void fromValue_acceptsKnownValues(String value, ScopeType expected) {
        assertThat(ScopeType.fromValue(value)).isEqualTo(expected);
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Folder", "Workspace"})
    @DisplayName("fromValue rejects unknown or missing values")
    void fromValue_rejectsUnknownValues(String value) {
        assertThatThrownBy(() -> ScopeType.fromValue(value))
                .isInstanceOf(InvalidScopeException.class);
    }

    @Test
    @DisplayName("only Global scopes have no resource id")
    void requiresScopeId() {
        assertThat(ScopeType.GLOBAL.requiresScopeId()).isFalse();
        assertThat(ScopeType.PROJECT.requiresScopeId()).isTrue();
        assertThat(ScopeType.FLOW.requiresScopeId()).isTrue();
    }
}
