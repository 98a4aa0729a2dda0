package de.bsommerfeld.workbench.prefetch;

/**
 * A leaf call that failed during a prefetch run. Recorded and logged, never
 * rethrown.
 *
 * @param entityKind project or worktree
 * @param entityId   id of the project or worktree
 * @param operation  the call that failed
 * @param cause      the unwrapped error
 */
public record FetchFailure(EntityKind entityKind, String entityId, FetchOperation operation, Throwable cause) {

    public static FetchFailure of(FetchOperation operation, String entityId, Throwable cause) {
        return new FetchFailure(operation.entityKind(), entityId, operation, cause);
    }
}
