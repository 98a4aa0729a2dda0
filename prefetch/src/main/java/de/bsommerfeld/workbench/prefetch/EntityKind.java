package de.bsommerfeld.workbench.prefetch;

/**
 * What a prefetch task was scoped to.
 */
public enum EntityKind {
    PROJECT,
    WORKTREE
}
