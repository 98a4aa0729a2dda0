package de.bsommerfeld.workbench.prefetch;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One-way latch that lets exactly one caller start a run. The check and the
 * transition to {@link RunState#RUNNING} are a single atomic step, so a second
 * trigger arriving while the first run is still in flight is rejected.
 */
public final class RunGuard {

    private final AtomicReference<RunState> state = new AtomicReference<>(RunState.NOT_STARTED);

    /**
     * @return {@code true} for exactly one caller over the guard's lifetime
     */
    public boolean tryStart() {
        return state.compareAndSet(RunState.NOT_STARTED, RunState.RUNNING);
    }

    /**
     * Moves a running guard to {@link RunState#DONE}. Has no effect in any
     * other state.
     */
    public void markDone() {
        state.compareAndSet(RunState.RUNNING, RunState.DONE);
    }

    public RunState state() {
        return state.get();
    }
}
