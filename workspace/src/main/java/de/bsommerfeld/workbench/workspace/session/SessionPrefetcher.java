package de.bsommerfeld.workbench.workspace.session;

import java.util.concurrent.CompletableFuture;

/**
 * Warms the {@link SessionCache} entry of one worktree.
 */
public interface SessionPrefetcher {

    /**
     * @return future completing once the worktree's session list is cached;
     *         fails with an I/O cause if the session index cannot be read
     */
    CompletableFuture<Void> prefetchSessions(String worktreeId, String worktreePath);
}
