package org.example.orchestration.config;

import org.example.orchestration.filter.PatternMatcher;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for LayerDefinition.
 */
class LayerDefinitionTest {

    @Test
    @DisplayName("should parse name and trimmed patterns")
    void shouldParse() {
        LayerDefinition layer = LayerDefinition.parse("core: *-core | shared|");

        assertThat(layer.getName()).isEqualTo("core");
        assertThat(layer.getPatterns()).containsExactly("*-core", "shared");
        assertThat(layer.toString()).isEqualTo("core:*-core|shared");
    }

    @Test
    @DisplayName("should throw when colon is missing")
    void shouldThrowWhenColonMissing() {
        assertThatThrownBy(() -> LayerDefinition.parse("core"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected format: name:pattern");
    }

    @Test
    @DisplayName("should throw when name or patterns are missing")
    void shouldThrowWhenPartsMissing() {
        assertThatThrownBy(() -> LayerDefinition.parse(":*-core"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Both name and at least one pattern are required");
        assertThatThrownBy(() -> LayerDefinition.parse("core: | "))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Both name and at least one pattern are required");
    }

    @Test
    @DisplayName("should compile patterns into matchers")
    void shouldCompileMatchers() {
        List<PatternMatcher> matchers = new LayerDefinition("web", List.of("web-*", "gateway")).toMatchers();

        assertThat(matchers).extracting(PatternMatcher::getPattern).containsExactly("web-*", "gateway");
        assertThat(matchers.get(0).matches("web-admin")).isTrue();
    }
}
