package de.bsommerfeld.workbench.prefetch;

import java.time.Duration;
import java.util.List;

/**
 * Summary of a finished startup prefetch.
 *
 * @param priorityProjects   projects in the expanded tier
 * @param backgroundProjects projects in the collapsed tier
 * @param succeeded          leaf calls that completed normally
 * @param failures           leaf calls that failed, in the order they were
 *                           recorded
 * @param elapsed            wall time from start to last chunk
 */
public record PrefetchReport(int priorityProjects, int backgroundProjects, int succeeded,
        List<FetchFailure> failures, Duration elapsed) {

    public PrefetchReport {
        failures = List.copyOf(failures);
    }

    public List<FetchFailure> failuresFor(String entityId) {
        return failures.stream().filter(f -> f.entityId().equals(entityId)).toList();
    }
}
