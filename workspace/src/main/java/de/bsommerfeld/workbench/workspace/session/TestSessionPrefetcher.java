package de.bsommerfeld.workbench.workspace.session;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.workspace.TestDataGenerator;
import de.bsommerfeld.workbench.workspace.WorkspaceExecutor;

import java.util.concurrent.CompletableFuture;

/**
 * TEST mode {@link SessionPrefetcher}: caches generated sessions, reads no
 * files.
 */
@Singleton
public class TestSessionPrefetcher implements SessionPrefetcher {

    private final SessionCache cache;
    private final WorkspaceExecutor executor;
    private final TestDataGenerator generator = new TestDataGenerator();

    @Inject
    public TestSessionPrefetcher(SessionCache cache, WorkspaceExecutor executor) {
        this.cache = cache;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> prefetchSessions(String worktreeId, String worktreePath) {
        return CompletableFuture.runAsync(() -> {
            Worktree worktree = new Worktree(worktreeId, null, worktreeId, worktreePath, null);
            cache.put(new WorktreeSessions(worktreeId, worktreePath, generator.generateSessions(worktree)));
        }, executor);
    }
}
