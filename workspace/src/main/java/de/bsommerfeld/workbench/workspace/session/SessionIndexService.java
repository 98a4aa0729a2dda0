package de.bsommerfeld.workbench.workspace.session;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.SessionSummary;
import de.bsommerfeld.workbench.workspace.WorkspaceExecutor;
import de.bsommerfeld.workbench.workspace.WorkspacePaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link SessionPrefetcher} that reads {@code sessions/index/{worktreeId}.json}
 * and caches the sessions sorted by their {@code order} field.
 *
 * <p>
 * A worktree without an index file has no sessions yet and is cached with an
 * empty list. An index that exists but cannot be parsed fails the prefetch.
 */
@Singleton
public class SessionIndexService implements SessionPrefetcher {

    private static final Logger LOG = LoggerFactory.getLogger(SessionIndexService.class);

    private final WorkspacePaths paths;
    private final SessionCache cache;
    private final WorkspaceExecutor executor;
    private final ObjectMapper mapper = new ObjectMapper();

    @Inject
    public SessionIndexService(WorkspacePaths paths, SessionCache cache, WorkspaceExecutor executor) {
        this.paths = paths;
        this.cache = cache;
        this.executor = executor;
    }

    @Override
    public CompletableFuture<Void> prefetchSessions(String worktreeId, String worktreePath) {
        return CompletableFuture.runAsync(() -> {
            List<SessionSummary> sessions = readIndex(worktreeId);
            cache.put(new WorktreeSessions(worktreeId, worktreePath, sessions));
            LOG.debug("Cached {} sessions for worktree {}", sessions.size(), worktreeId);
        }, executor);
    }

    private List<SessionSummary> readIndex(String worktreeId) {
        Path indexFile = paths.sessionIndexFile(worktreeId);
        if (!Files.exists(indexFile))
            return List.of();
        try {
            SessionIndex index = mapper.readValue(indexFile.toFile(), SessionIndex.class);
            return index.sessions().stream()
                    .sorted(Comparator.comparingInt(SessionSummary::order))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read session index " + indexFile, e);
        }
    }

    /**
     * On-disk shape of a worktree's session index.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record SessionIndex(
            @JsonProperty("worktree_id") String worktreeId,
            @JsonProperty("sessions") List<SessionSummary> sessions) {

        SessionIndex {
            sessions = sessions != null ? sessions : List.of();
        }
    }
}
