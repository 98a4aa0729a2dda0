package de.bsommerfeld.workbench.workspace;

import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory {@link WorkspaceService} for TEST mode: no projects.json, no disk
 * I/O. Bound by Guice when the application starts with {@code app.mode=TEST}.
 *
 * <p>
 * The constructor pre-seeds 8 projects plus one folder, each project with 1–3
 * worktrees, so the prefetch pipeline has a realistic mix to chew on
 * immediately. See {@link TestDataGenerator} for the distributions.
 */
@Singleton
public class TestWorkspaceService implements WorkspaceService {

    private static final Logger LOG = LoggerFactory.getLogger(TestWorkspaceService.class);

    private final List<Project> projects;
    private final Map<String, List<Worktree>> worktrees = new HashMap<>();

    public TestWorkspaceService() {
        this(new TestDataGenerator(), 8);
    }

    public TestWorkspaceService(TestDataGenerator generator, int projectCount) {
        LOG.warn("#########################################################");
        LOG.warn("#  TEST MODE ENABLED: Workspace is generated in memory  #");
        LOG.warn("#########################################################");

        this.projects = List.copyOf(generator.generateProjects(projectCount));
        for (Project p : projects) {
            if (!p.isFolder())
                worktrees.put(p.id(), List.copyOf(generator.generateWorktrees(p)));
        }
    }

    @Override
    public List<Project> getProjects() {
        return projects;
    }

    @Override
    public List<Worktree> getWorktrees(String projectId) {
        List<Worktree> result = worktrees.get(projectId);
        if (result == null)
            throw WorkspaceException.notFound("Unknown project: " + projectId);
        return result;
    }
}
