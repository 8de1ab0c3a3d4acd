package org.example.orchestration.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for Project and ProjectDependency.
 */
class ProjectTest {

    @Nested
    @DisplayName("Project")
    class ProjectValue {

        @Test
        @DisplayName("should apply builder defaults")
        void shouldApplyBuilderDefaults() {
            Project project = Project.builder().name("core").build();

            assertThat(project.getPath()).isEqualTo(Path.of("core"));
            assertThat(project.getVersion()).isEqualTo("0.1.0");
            assertThat(project.getStatus()).isEqualTo(ProjectStatus.HEALTHY);
            assertThat(project.toString()).isEqualTo("core@0.1.0");
        }

        @Test
        @DisplayName("should throw when name is null")
        void shouldThrowWhenNameNull() {
            assertThatNullPointerException()
                    .isThrownBy(() -> new Project(Path.of("x"), null, "jar", "1.0.0", ProjectStatus.HEALTHY))
                    .withMessage("name cannot be null");
        }

        @Test
        @DisplayName("should copy on version change and leave original untouched")
        void shouldCopyOnVersionChange() {
            Project original = Project.builder().name("core").version("1.0.0").build();

            Project updated = original.withVersion("1.1.0");

            assertThat(updated.getVersion()).isEqualTo("1.1.0");
            assertThat(updated.getName()).isEqualTo("core");
            assertThat(original.getVersion()).isEqualTo("1.0.0");
            assertThat(updated).isNotEqualTo(original);
        }

        @Test
        @DisplayName("should copy on status change")
        void shouldCopyOnStatusChange() {
            Project original = Project.builder().name("core").build();

            assertThat(original.withStatus(ProjectStatus.CRITICAL).getStatus()).isEqualTo(ProjectStatus.CRITICAL);
            assertThat(original.getStatus()).isEqualTo(ProjectStatus.HEALTHY);
        }
    }

    @Nested
    @DisplayName("ProjectDependency")
    class Dependency {

        @Test
        @DisplayName("should create direct dependency without constraint")
        void shouldCreateDirectDependency() {
            ProjectDependency dependency = ProjectDependency.direct("cli", "core");

            assertThat(dependency.getDependencyType()).isEqualTo(DependencyType.DIRECT);
            assertThat(dependency.hasVersionConstraint()).isFalse();
            assertThat(dependency.getEdgeDescription()).isEqualTo("cli -> core (direct)");
        }

        @Test
        @DisplayName("should describe constraint in edge description")
        void shouldDescribeConstraint() {
            ProjectDependency dependency = ProjectDependency.builder()
                    .from("cli")
                    .to("core")
                    .dependencyType(DependencyType.DEV)
                    .versionConstraint("^1.2.0")
                    .build();

            assertThat(dependency.hasVersionConstraint()).isTrue();
            assertThat(dependency.getEdgeDescription()).isEqualTo("cli -> core (dev, ^1.2.0)");
        }
    }

    @Nested
    @DisplayName("Severity")
    class SeverityOrdering {

        @Test
        @DisplayName("should order severities from info to critical")
        void shouldOrderSeverities() {
            assertThat(Severity.CRITICAL.isAtLeast(Severity.WARNING)).isTrue();
            assertThat(Severity.WARNING.isAtLeast(Severity.WARNING)).isTrue();
            assertThat(Severity.INFO.isAtLeast(Severity.WARNING)).isFalse();
        }

        @Test
        @DisplayName("should parse severity ignoring case")
        void shouldParseSeverity() {
            assertThat(Severity.fromString(" Critical ")).isEqualTo(Severity.CRITICAL);
            assertThatThrownBy(() -> Severity.fromString("fatal"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unknown severity");
        }
    }
}
