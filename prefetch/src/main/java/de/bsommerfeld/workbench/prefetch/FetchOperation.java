package de.bsommerfeld.workbench.prefetch;

/**
 * The leaf calls the startup prefetch issues.
 */
public enum FetchOperation {

    GIT_STATUS(EntityKind.PROJECT, "fetch git status"),
    LIST_WORKTREES(EntityKind.PROJECT, "list worktrees"),
    PREFETCH_SESSIONS(EntityKind.WORKTREE, "prefetch sessions");

    private final EntityKind entityKind;
    private final String description;

    FetchOperation(EntityKind entityKind, String description) {
        this.entityKind = entityKind;
        this.description = description;
    }

    public EntityKind entityKind() {
        return entityKind;
    }

    public String description() {
        return description;
    }
}
