package de.bsommerfeld.workbench.prefetch;

/**
 * Result of one leaf call: success, or the failure that replaced it.
 */
public record TaskOutcome(FetchOperation operation, String entityId, FetchFailure failure) {

    public static TaskOutcome success(FetchOperation operation, String entityId) {
        return new TaskOutcome(operation, entityId, null);
    }

    public static TaskOutcome failure(FetchFailure failure) {
        return new TaskOutcome(failure.operation(), failure.entityId(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
