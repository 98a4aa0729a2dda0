package de.bsommerfeld.workbench.workspace.session;

import com.google.inject.Singleton;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session lists keyed by worktree id.
 */
@Singleton
public class SessionCache {

    private final Map<String, WorktreeSessions> byWorktree = new ConcurrentHashMap<>();

    public void put(WorktreeSessions sessions) {
        byWorktree.put(sessions.worktreeId(), sessions);
    }

    public Optional<WorktreeSessions> get(String worktreeId) {
        return Optional.ofNullable(byWorktree.get(worktreeId));
    }

    public boolean contains(String worktreeId) {
        return byWorktree.containsKey(worktreeId);
    }

    public int size() {
        return byWorktree.size();
    }
}
