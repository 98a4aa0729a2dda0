package de.bsommerfeld.workbench.workspace.git;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.GitStatus;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.workspace.TestDataGenerator;
import de.bsommerfeld.workbench.workspace.WorkspaceExecutor;
import de.bsommerfeld.workbench.workspace.WorkspaceService;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * TEST mode {@link GitStatusFetcher}: fills the cache with generated statuses
 * instead of spawning git.
 */
@Singleton
public class TestGitStatusFetcher implements GitStatusFetcher {

    private final WorkspaceService workspaceService;
    private final GitStatusCache cache;
    private final WorkspaceExecutor executor;
    private final TestDataGenerator generator = new TestDataGenerator();

    @Inject
    public TestGitStatusFetcher(WorkspaceService workspaceService, GitStatusCache cache,
            WorkspaceExecutor executor) {
        this.workspaceService = workspaceService;
        this.cache = cache;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> fetchGitStatus(String projectId) {
        return CompletableFuture.runAsync(() -> {
            Map<String, GitStatus> statuses = new LinkedHashMap<>();
            for (Worktree w : workspaceService.getWorktrees(projectId)) {
                statuses.put(w.id(), generator.generateStatus(w));
            }
            cache.put(projectId, statuses);
        }, executor);
    }
}
