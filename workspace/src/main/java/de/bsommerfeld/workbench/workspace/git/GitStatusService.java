package de.bsommerfeld.workbench.workspace.git;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.GitStatus;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.workspace.WorkspaceExecutor;
import de.bsommerfeld.workbench.workspace.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;

/**
 * {@link GitStatusFetcher} that runs {@code git status} in every worktree of a
 * project and stores the results in the {@link GitStatusCache}.
 *
 * <p>
 * Worktrees are queried one after another on a single I/O thread. If one of
 * them fails, the statuses that did succeed are still cached and the future
 * fails with the first error.
 */
@Singleton
public class GitStatusService implements GitStatusFetcher {

    private static final Logger LOG = LoggerFactory.getLogger(GitStatusService.class);

    private final WorkspaceService workspaceService;
    private final GitCommandRunner runner;
    private final GitStatusCache cache;
    private final WorkspaceExecutor executor;

    @Inject
    public GitStatusService(WorkspaceService workspaceService, GitCommandRunner runner, GitStatusCache cache,
            WorkspaceExecutor executor) {
        this.workspaceService = workspaceService;
        this.runner = runner;
        this.cache = cache;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> fetchGitStatus(String projectId) {
        return CompletableFuture.runAsync(() -> refresh(projectId), executor);
    }

    private void refresh(String projectId) {
        List<Worktree> worktrees = workspaceService.getWorktrees(projectId);
        Map<String, GitStatus> statuses = new LinkedHashMap<>();
        Exception firstError = null;

        for (Worktree worktree : worktrees) {
            try {
                String output = runner.run(Paths.get(worktree.path()), "status", "--porcelain=v1", "--branch");
                statuses.put(worktree.id(), GitStatusParser.parse(worktree.id(), output, System.currentTimeMillis()));
            } catch (IOException | TimeoutException e) {
                if (firstError == null)
                    firstError = e;
                LOG.debug("git status failed for worktree {}: {}", worktree.id(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }

        cache.put(projectId, statuses);
        LOG.debug("Cached git status for project {} ({} of {} worktrees)", projectId, statuses.size(),
                worktrees.size());
        if (firstError != null)
            throw new CompletionException(firstError);
    }
}
