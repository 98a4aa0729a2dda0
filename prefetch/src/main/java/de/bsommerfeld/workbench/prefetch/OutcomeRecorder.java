package de.bsommerfeld.workbench.prefetch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Collects the outcomes of one run. Written concurrently by leaf callbacks.
 */
final class OutcomeRecorder {

    private final AtomicInteger succeeded = new AtomicInteger();
    private final Queue<FetchFailure> failures = new ConcurrentLinkedQueue<>();

    void record(TaskOutcome outcome) {
        if (outcome.isSuccess()) {
            succeeded.incrementAndGet();
        } else {
            failures.add(outcome.failure());
        }
    }

    PrefetchReport toReport(PrefetchTiers tiers, Duration elapsed) {
        return new PrefetchReport(tiers.priority().size(), tiers.background().size(), succeeded.get(),
                new ArrayList<>(failures), elapsed);
    }
}
