package org.example.orchestration.version;

import org.example.orchestration.exception.IncompatibleVersionException;
import org.example.orchestration.exception.InvalidConfigurationException;
import org.example.orchestration.exception.InvalidVersionException;
import org.example.orchestration.exception.UnknownProjectException;
import org.example.orchestration.graph.DependencyGraph;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for VersionCoordinator.
 */
class VersionCoordinatorTest {

    private DependencyGraph graph;
    private VersionCoordinator coordinator;

    private static Project project(String name, String version) {
        return Project.builder().name(name).version(version).build();
    }

    /**
     * core is used by storage and api; api also uses storage. storage pins core to ^1.0.0.
     */
    @BeforeEach
    void setUp() throws Exception {
        graph = DependencyGraph.builder()
                .addProject(project("core", "1.0.0"))
                .addProject(project("storage", "1.0.0"))
                .addProject(project("api", "1.0.0"))
                .addDependency(ProjectDependency.builder().from("storage").to("core").versionConstraint("^1.0.0").build())
                .addDependency(ProjectDependency.direct("api", "core"))
                .addDependency(ProjectDependency.direct("api", "storage"))
                .build();
        coordinator = new VersionCoordinator(graph);
        for (Project p : graph.getProjects()) {
            coordinator.registerProject(p);
        }
    }

    @Nested
    @DisplayName("Updating Versions")
    class UpdatingVersions {

        @Test
        @DisplayName("should accept compatible update and reject major bump under caret constraint")
        void shouldEnforceCaretConstraint() throws Exception {
            VersionCoordinator standalone = new VersionCoordinator(new DependencyGraph(true));
            standalone.registerProject(project("api", "1.0.0"));
            standalone.registerConstraint("api", "^1.0.0");

            VersionUpdateResult result = standalone.updateVersion("api", "1.2.0");

            assertThat(result.isSuccess()).isTrue();
            assertThat(result.getError()).isEmpty();
            assertThat(result.getOldVersion()).isEqualTo("1.0.0");
            assertThat(result.getNewVersion()).isEqualTo("1.2.0");
            assertThat(result.isBreaking()).isFalse();
            assertThat(standalone.getVersion("api")).contains("1.2.0");

            assertThatThrownBy(() -> standalone.updateVersion("api", "2.0.0"))
                    .isInstanceOf(IncompatibleVersionException.class)
                    .satisfies(e -> {
                        IncompatibleVersionException ive = (IncompatibleVersionException) e;
                        assertThat(ive.getProjectName()).isEqualTo("api");
                        assertThat(ive.getVersion()).isEqualTo("2.0.0");
                        assertThat(ive.getConstraint()).isEqualTo("^1.0.0");
                    });
            assertThat(standalone.getVersion("api")).contains("1.2.0");
        }

        @Test
        @DisplayName("should report affected projects and breaking flag")
        void shouldReportAffectedProjects() throws Exception {
            VersionUpdateResult result = coordinator.updateVersion("core", "2.0.0");

            assertThat(result.getAffectedProjects()).containsExactly("storage", "api");
            assertThat(result.isBreaking()).isTrue();
        }

        @Test
        @DisplayName("should throw for unregistered project")
        void shouldThrowForUnregisteredProject() {
            assertThatThrownBy(() -> coordinator.updateVersion("missing", "1.0.0"))
                    .isInstanceOf(UnknownProjectException.class);
        }

        @Test
        @DisplayName("should check version format before registration")
        void shouldCheckVersionFirst() {
            assertThatThrownBy(() -> coordinator.updateVersion("missing", "1.0"))
                    .isInstanceOf(InvalidVersionException.class);
        }

        @Test
        @DisplayName("should overwrite earlier registration")
        void shouldOverwriteRegistration() {
            coordinator.registerProject(project("core", "3.0.0"));

            assertThat(coordinator.getVersion("core")).contains("3.0.0");
            assertThat(coordinator.getAllProjects()).hasSize(3);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should accept any parseable version without constraints")
        void shouldAcceptWithoutConstraints() {
            assertThatCode(() -> coordinator.validateVersionUpdate("unregistered", "42.0.0"))
                    .doesNotThrowAnyException();
        }

        @Test
        @DisplayName("should reject unparseable version")
        void shouldRejectUnparseableVersion() {
            assertThatThrownBy(() -> coordinator.validateVersionUpdate("core", "latest"))
                    .isInstanceOf(InvalidVersionException.class);
        }

        @Test
        @DisplayName("should check every registered constraint")
        void shouldCheckEveryConstraint() throws Exception {
            coordinator.registerConstraint("core", ">=1.0.0");
            coordinator.registerConstraint("core", "~1.2.0");

            coordinator.validateVersionUpdate("core", "1.2.5");
            assertThatThrownBy(() -> coordinator.validateVersionUpdate("core", "1.3.0"))
                    .isInstanceOf(IncompatibleVersionException.class)
                    .hasMessageContaining("~1.2.0");
            assertThat(coordinator.getConstraints("core")).containsExactly(">=1.0.0", "~1.2.0");
        }

        @Test
        @DisplayName("should report malformed constraint when validating")
        void shouldReportMalformedConstraint() {
            coordinator.registerConstraint("core", "=1.0.0");

            assertThatThrownBy(() -> coordinator.validateVersionUpdate("core", "1.0.0"))
                    .isInstanceOf(InvalidConfigurationException.class);
        }

        @Test
        @DisplayName("should classify breaking changes against the registered version")
        void shouldClassifyBreakingChanges() throws Exception {
            assertThat(coordinator.isBreakingChange("core", "2.0.0")).isTrue();
            assertThat(coordinator.isBreakingChange("core", "1.5.0")).isFalse();

            assertThatThrownBy(() -> coordinator.isBreakingChange("missing", "2.0.0"))
                    .isInstanceOf(UnknownProjectException.class);
            assertThatThrownBy(() -> coordinator.isBreakingChange("core", "two"))
                    .isInstanceOf(InvalidVersionException.class);
        }

        @Test
        @DisplayName("should treat minor and patch downgrades within a major as non-breaking")
        void shouldNotFlagDowngradeWithinMajor() throws Exception {
            coordinator.registerProject(project("storage", "1.5.3"));

            assertThat(coordinator.isBreakingChange("storage", "1.2.0")).isFalse();
            assertThat(coordinator.isBreakingChange("storage", "1.5.1")).isFalse();
            assertThat(coordinator.isBreakingChange("storage", "0.9.0")).isTrue();
        }
    }

    @Nested
    @DisplayName("Planning")
    class Planning {

        @Test
        @DisplayName("should mark plan invalid for unknown project with nothing registered")
        void shouldMarkPlanInvalidForUnknownProject() {
            VersionCoordinator empty = new VersionCoordinator(new DependencyGraph(true));

            VersionUpdatePlan plan = empty.planVersionUpdates(List.of(Map.entry("missing-project", "1.0.0")));

            assertThat(plan.isValid()).isFalse();
            assertThat(plan.getValidationErrors()).containsExactly("Project not found: missing-project");
            assertThat(plan.getUpdates()).isEmpty();
        }

        @Test
        @DisplayName("should keep request order and count distinct affected projects")
        void shouldBuildValidPlan() {
            Map<String, String> updates = new LinkedHashMap<>();
            updates.put("core", "2.0.0");
            updates.put("storage", "1.1.0");

            VersionUpdatePlan plan = coordinator.planVersionUpdates(updates);

            assertThat(plan.isValid()).isTrue();
            assertThat(plan.getUpdates()).extracting(VersionUpdateStep::getProject).containsExactly("core", "storage");
            assertThat(plan.getUpdates().get(0).getDependents()).containsExactly("storage", "api");
            assertThat(plan.getUpdates().get(0).isBreaking()).isTrue();
            assertThat(plan.getUpdates().get(1).getDependents()).containsExactly("api");
            assertThat(plan.getUpdates().get(1).isBreaking()).isFalse();
            assertThat(plan.getTotalAffected()).isEqualTo(2);
            assertThat(plan.hasBreakingChanges()).isTrue();
        }

        @Test
        @DisplayName("should collect an error per invalid pair without throwing")
        void shouldCollectErrors() {
            VersionUpdatePlan plan = coordinator.planVersionUpdates(List.of(
                    Map.entry("core", "abc"),
                    Map.entry("ghost", "1.0.0"),
                    Map.entry("api", "1.0.1")));

            assertThat(plan.isValid()).isFalse();
            assertThat(plan.getValidationErrors()).hasSize(2);
            assertThat(plan.getValidationErrors().get(0)).startsWith("Invalid version for core:");
            assertThat(plan.getValidationErrors().get(1)).isEqualTo("Project not found: ghost");
            assertThat(plan.getUpdates()).extracting(VersionUpdateStep::getProject).containsExactly("api");
        }

        @Test
        @DisplayName("should not evaluate constraints while planning")
        void shouldIgnoreConstraintsWhilePlanning() {
            coordinator.registerConstraint("core", "^1.0.0");

            assertThat(coordinator.planVersionUpdates(Map.of("core", "2.0.0")).isValid()).isTrue();
        }
    }

    @Nested
    @DisplayName("Applying Plans")
    class ApplyingPlans {

        @Test
        @DisplayName("should reject invalid plan")
        void shouldRejectInvalidPlan() {
            VersionUpdatePlan plan = coordinator.planVersionUpdates(Map.of("ghost", "1.0.0"));

            assertThatThrownBy(() -> coordinator.applyPlan(plan))
                    .isInstanceOf(InvalidConfigurationException.class)
                    .satisfies(e -> assertThat(((InvalidConfigurationException) e).getValidationErrors())
                            .containsExactly("Project not found: ghost"));
        }

        @Test
        @DisplayName("should apply nothing when any step fails validation")
        void shouldApplyAllOrNothing() {
            coordinator.registerConstraint("core", "^1.0.0");
            VersionUpdatePlan plan = coordinator.planVersionUpdates(List.of(
                    Map.entry("storage", "1.1.0"),
                    Map.entry("core", "2.0.0")));

            assertThatThrownBy(() -> coordinator.applyPlan(plan))
                    .isInstanceOf(IncompatibleVersionException.class);
            assertThat(coordinator.getVersion("storage")).contains("1.0.0");
            assertThat(coordinator.getVersion("core")).contains("1.0.0");
        }

        @Test
        @DisplayName("should apply steps in order and flag broken dependent constraints")
        void shouldFlagBrokenDependentConstraints() throws Exception {
            VersionUpdatePlan plan = coordinator.planVersionUpdates(List.of(
                    Map.entry("api", "1.1.0"),
                    Map.entry("core", "2.0.0")));

            List<VersionUpdateResult> results = coordinator.applyPlan(plan);

            assertThat(results).extracting(VersionUpdateResult::getProject).containsExactly("api", "core");
            assertThat(results.get(0).isSuccess()).isTrue();
            assertThat(results.get(1).isSuccess()).isFalse();
            assertThat(results.get(1).getError()).hasValueSatisfying(error ->
                    assertThat(error).contains("storage requires ^1.0.0"));
            assertThat(coordinator.getVersion("core")).contains("2.0.0");
            assertThat(coordinator.getVersion("api")).contains("1.1.0");
        }
    }

    @Nested
    @DisplayName("State")
    class State {

        @Test
        @DisplayName("should forget projects and constraints on clear but keep the graph")
        void shouldClear() {
            coordinator.registerConstraint("core", "^1.0.0");

            coordinator.clear();

            assertThat(coordinator.getAllProjects()).isEmpty();
            assertThat(coordinator.getConstraints("core")).isEmpty();
            assertThat(coordinator.getVersion("core")).isEmpty();
            assertThat(coordinator.getAffectedProjects("core")).extracting(Project::getName)
                    .containsExactly("storage", "api");
        }

        @Test
        @DisplayName("should not observe later changes to the caller's graph")
        void shouldSnapshotGraph() throws Exception {
            graph.addProject(project("web", "1.0.0"));
            graph.addDependency(ProjectDependency.direct("web", "core"));

            assertThat(coordinator.getAffectedProjects("core")).extracting(Project::getName)
                    .containsExactly("storage", "api");
        }

        @Test
        @DisplayName("should return empty affected list for leaf, unknown and null projects")
        void shouldReturnEmptyAffected() {
            assertThat(coordinator.getAffectedProjects("api")).isEmpty();
            assertThat(coordinator.getAffectedProjects("nobody")).isEmpty();
            assertThat(coordinator.getAffectedProjects(null)).isEmpty();
        }

        @Test
        @DisplayName("should report affected projects at their updated versions")
        void shouldReportAffectedAtCurrentVersions() throws Exception {
            coordinator.updateVersion("api", "1.5.0");

            assertThat(coordinator.getAffectedProjects("core"))
                    .extracting(Project::getName, Project::getVersion)
                    .containsExactly(tuple("storage", "1.0.0"), tuple("api", "1.5.0"));
            assertThat(coordinator.getVersion("api")).contains("1.5.0");
        }

        @Test
        @DisplayName("should fall back to graph data for dependents never registered")
        void shouldFallBackToGraphForUnregisteredDependents() {
            coordinator.clear();
            coordinator.registerProject(project("api", "1.7.0"));

            assertThat(coordinator.getAffectedProjects("core"))
                    .extracting(Project::getName, Project::getVersion)
                    .containsExactly(tuple("storage", "1.0.0"), tuple("api", "1.7.0"));
        }
    }
}
