package de.bsommerfeld.workbench.core.domain;

/**
 * Snapshot of {@code git status} for one worktree.
 *
 * @param worktreeId     worktree the status belongs to
 * @param branch         current branch, {@code null} when detached
 * @param ahead          commits ahead of upstream
 * @param behind         commits behind upstream
 * @param stagedCount    entries with index changes
 * @param unstagedCount  entries with working tree changes
 * @param untrackedCount untracked entries
 * @param fetchedAt      epoch millis when the status was taken
 */
public record GitStatus(
        String worktreeId,
        String branch,
        int ahead,
        int behind,
        int stagedCount,
        int unstagedCount,
        int untrackedCount,
        long fetchedAt) {

    public boolean isClean() {
        return stagedCount == 0 && unstagedCount == 0 && untrackedCount == 0;
    }
}
