package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.domain.GitStatus;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.SessionSummary;
import de.bsommerfeld.workbench.core.domain.Worktree;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates a plausible dummy workspace for TEST mode, so the prefetch
 * pipeline and everything downstream of the caches behave as in production
 * without a real projects.json, git binary or session store.
 *
 * <h3>What the output looks like</h3>
 * <ul>
 * <li><strong>Projects</strong>: one folder up front, then repository
 * projects named after common services, each with 1–3 worktrees</li>
 * <li><strong>Git status</strong>: random ahead/behind and change counts,
 * about a third of worktrees clean</li>
 * <li><strong>Sessions</strong>: 0–4 sessions per worktree, ordered</li>
 * </ul>
 *
 * Pure data factory with no side effects. Pass a seeded {@link Random} for
 * reproducible output.
 */
public class TestDataGenerator {

    private static final String[] PROJECT_NAMES = { "billing-service", "web-frontend", "auth-gateway",
            "search-indexer", "mobile-app", "infra", "docs-site", "data-pipeline" };
    private static final String[] BRANCHES = { "main", "feature/login", "fix/flaky-test", "spike/cache",
            "release/2.4" };
    private static final String[] SESSION_NAMES = { "Session 1", "Refactor auth", "Fix CI", "Explore schema",
            "Review PR" };

    private final Random rnd;

    public TestDataGenerator(Random rnd) {
        this.rnd = rnd;
    }

    public TestDataGenerator() {
        this(new Random());
    }

    /**
     * @param count number of non-folder projects; one folder is prepended
     */
    public List<Project> generateProjects(int count) {
        List<Project> projects = new ArrayList<>();
        projects.add(new Project("folder-1", "Work", null, true, null, 0));
        for (int i = 0; i < count; i++) {
            String name = PROJECT_NAMES[i % PROJECT_NAMES.length] + (i >= PROJECT_NAMES.length ? "-" + i : "");
            projects.add(new Project("project-" + i, name, "/tmp/workbench-test/" + name, false,
                    i % 3 == 0 ? "folder-1" : null, i + 1));
        }
        return projects;
    }

    public List<Worktree> generateWorktrees(Project project) {
        int count = 1 + rnd.nextInt(3);
        List<Worktree> worktrees = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            String branch = i == 0 ? "main" : BRANCHES[rnd.nextInt(BRANCHES.length)];
            String id = project.id() + "-wt-" + i;
            worktrees.add(new Worktree(id, project.id(), project.name() + "/" + branch,
                    project.path() + "/" + id, branch));
        }
        return worktrees;
    }

    public GitStatus generateStatus(Worktree worktree) {
        boolean clean = rnd.nextInt(3) == 0;
        return new GitStatus(worktree.id(), worktree.branch(),
                rnd.nextInt(4), rnd.nextInt(3),
                clean ? 0 : rnd.nextInt(5),
                clean ? 0 : rnd.nextInt(8),
                clean ? 0 : rnd.nextInt(3),
                System.currentTimeMillis());
    }

    public List<SessionSummary> generateSessions(Worktree worktree) {
        int count = rnd.nextInt(5);
        List<SessionSummary> sessions = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            sessions.add(new SessionSummary(worktree.id() + "-s" + i,
                    SESSION_NAMES[rnd.nextInt(SESSION_NAMES.length)], i));
        }
        return sessions;
    }
}
