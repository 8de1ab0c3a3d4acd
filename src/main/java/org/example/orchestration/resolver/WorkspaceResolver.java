package org.example.orchestration.resolver;

import org.apache.maven.execution.MavenSession;
import org.apache.maven.model.Dependency;
import org.apache.maven.project.MavenProject;
import org.example.orchestration.config.WorkspaceConfig;
import org.example.orchestration.model.DependencyType;
import org.example.orchestration.model.Project;
import org.example.orchestration.model.ProjectDependency;
import org.example.orchestration.model.Workspace;
import org.example.orchestration.version.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.nio.file.Path;
import java.util.*;

/**
 * Builds a {@link Workspace} snapshot from the Maven reactor.
 *
 * Every reactor project becomes a workspace project named by its artifactId. A declared
 * dependency on another reactor project becomes an edge; dependencies outside the
 * reactor are ignored. Test-scoped dependencies become DEV edges, all others DIRECT.
 */
public class WorkspaceResolver {

    private static final Logger log = LoggerFactory.getLogger(WorkspaceResolver.class);

    private static final String SNAPSHOT_SUFFIX = "-SNAPSHOT";

    private final MavenProject project;
    private final MavenSession session;

    /**
     * Creates a new WorkspaceResolver.
     *
     * @param project The current Maven project
     * @param session The Maven session (may be null for single-module projects)
     */
    public WorkspaceResolver(MavenProject project, MavenSession session) {
        this.project = Objects.requireNonNull(project, "project cannot be null");
        this.session = session;
    }

    /**
     * Resolves the workspace for the current reactor.
     *
     * @param config the policy configuration to attach
     * @return the resolved Workspace
     */
    public Workspace resolve(WorkspaceConfig config) {
        List<MavenProject> reactorProjects = findReactorProjects();
        log.info("Resolving workspace from {} reactor project(s)", reactorProjects.size());

        Map<String, MavenProject> byKey = new LinkedHashMap<>();
        for (MavenProject mp : reactorProjects) {
            byKey.putIfAbsent(key(mp.getGroupId(), mp.getArtifactId()), mp);
        }

        Workspace.Builder builder = Workspace.builder()
                .root(resolveRoot())
                .config(config);

        for (MavenProject mp : byKey.values()) {
            builder.addProject(createProject(mp));
        }

        int edges = 0;
        for (MavenProject mp : byKey.values()) {
            List<Dependency> declared = mp.getDependencies();
            if (declared == null) {
                continue;
            }
            for (Dependency dependency : declared) {
                MavenProject target = byKey.get(key(dependency.getGroupId(), dependency.getArtifactId()));
                if (target == null || target == mp) {
                    continue;
                }
                builder.addDependency(createDependency(mp, target, dependency));
                edges++;
            }
        }

        Workspace workspace = builder.build();
        log.info("Resolved workspace: {} project(s), {} internal dependency edge(s)", byKey.size(), edges);
        return workspace;
    }

    /**
     * Returns the reactor projects, or just the current project when no reactor is available.
     */
    private List<MavenProject> findReactorProjects() {
        if (session != null) {
            List<MavenProject> reactorProjects = session.getProjects();
            if (reactorProjects != null && !reactorProjects.isEmpty()) {
                return reactorProjects;
            }
        }
        return List.of(project);
    }

    private Path resolveRoot() {
        MavenProject root = session != null ? session.getTopLevelProject() : null;
        File basedir = (root != null ? root : project).getBasedir();
        return basedir != null ? basedir.toPath() : Path.of(".");
    }

    private Project createProject(MavenProject mp) {
        Project.Builder builder = Project.builder()
                .name(mp.getArtifactId())
                .projectType(mp.getPackaging() != null ? mp.getPackaging() : "jar")
                .version(toSemanticVersion(mp.getVersion()));
        if (mp.getBasedir() != null) {
            builder.path(mp.getBasedir().toPath());
        }
        return builder.build();
    }

    private ProjectDependency createDependency(MavenProject from, MavenProject to, Dependency dependency) {
        DependencyType type = "test".equals(dependency.getScope()) ? DependencyType.DEV : DependencyType.DIRECT;
        String version = toSemanticVersion(dependency.getVersion());
        String constraint = Version.isValid(version) ? "^" + version : "";

        log.debug("Reactor dependency {} -> {} ({}, constraint '{}')",
                from.getArtifactId(), to.getArtifactId(), type, constraint);
        return ProjectDependency.builder()
                .from(from.getArtifactId())
                .to(to.getArtifactId())
                .dependencyType(type)
                .versionConstraint(constraint)
                .build();
    }

    /**
     * Strips the Maven snapshot qualifier so that {@code 1.2.0-SNAPSHOT} reads as {@code 1.2.0}.
     */
    static String toSemanticVersion(String mavenVersion) {
        if (mavenVersion == null) {
            return "";
        }
        String trimmed = mavenVersion.trim();
        if (trimmed.endsWith(SNAPSHOT_SUFFIX)) {
            return trimmed.substring(0, trimmed.length() - SNAPSHOT_SUFFIX.length());
        }
        return trimmed;
    }

    private static String key(String groupId, String artifactId) {
        return groupId + ":" + artifactId;
    }
}
