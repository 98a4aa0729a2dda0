package de.bsommerfeld.workbench.workspace.session;

import de.bsommerfeld.workbench.core.domain.SessionSummary;

import java.util.List;

/**
 * Cached session list of one worktree, ordered for display.
 */
public record WorktreeSessions(String worktreeId, String worktreePath, List<SessionSummary> sessions) {

    public WorktreeSessions {
        sessions = sessions != null ? List.copyOf(sessions) : List.of();
    }
}
