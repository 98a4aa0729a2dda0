package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.domain.Worktree;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous worktree discovery for a single project.
 */
public interface WorktreeLister {

    /**
     * @return future completing with the project's worktrees in index order,
     *         or failing with a {@link WorkspaceException}
     */
    CompletableFuture<List<Worktree>> listWorktrees(String projectId);
}
