package org.example.orchestration.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for NamingConvention.
 */
class NamingConventionTest {

    @ParameterizedTest
    @DisplayName("should accept or reject names per convention")
    @CsvSource({
            "KEBAB_CASE, my-project-2, true",
            "KEBAB_CASE, core, true",
            "KEBAB_CASE, My-Project, false",
            "KEBAB_CASE, my--project, false",
            "KEBAB_CASE, -core, false",
            "KEBAB_CASE, core-, false",
            "KEBAB_CASE, my_project, false",
            "SNAKE_CASE, my_project, true",
            "SNAKE_CASE, my-project, false",
            "CAMEL_CASE, myProject, true",
            "CAMEL_CASE, MyProject, false",
            "PASCAL_CASE, MyProject, true",
            "PASCAL_CASE, myProject, false"
    })
    void shouldApplyConvention(NamingConvention convention, String name, boolean accepted) {
        assertThat(convention.accepts(name)).isEqualTo(accepted);
    }

    @ParameterizedTest
    @DisplayName("should resolve convention from display or constant name")
    @CsvSource({
            "kebab-case, KEBAB_CASE",
            "KEBAB_CASE, KEBAB_CASE",
            "snake-case, SNAKE_CASE",
            "camelCase, CAMEL_CASE",
            "pascal_case, PASCAL_CASE"
    })
    void shouldResolveFromString(String value, NamingConvention expected) {
        assertThat(NamingConvention.fromString(value)).isEqualTo(expected);
    }

    @Test
    @DisplayName("should reject unknown convention")
    void shouldRejectUnknownConvention() {
        assertThatThrownBy(() -> NamingConvention.fromString("screaming"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown naming convention");
    }

    @Test
    @DisplayName("should not accept null name")
    void shouldNotAcceptNull() {
        assertThat(NamingConvention.KEBAB_CASE.accepts(null)).isFalse();
    }
}
