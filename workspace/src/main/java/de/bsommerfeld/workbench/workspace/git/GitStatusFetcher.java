package de.bsommerfeld.workbench.workspace.git;

import java.util.concurrent.CompletableFuture;

/**
 * Warms the {@link GitStatusCache} entry of one project.
 */
public interface GitStatusFetcher {

    /**
     * @return future completing once the project's entry is cached; fails with
     *         an {@link java.io.IOException} or a
     *         {@link java.util.concurrent.TimeoutException} cause
     */
    CompletableFuture<Void> fetchGitStatus(String projectId);
}
