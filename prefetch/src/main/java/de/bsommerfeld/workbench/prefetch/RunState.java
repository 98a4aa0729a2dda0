package de.bsommerfeld.workbench.prefetch;

/**
 * Lifecycle of a {@link StartupPrefetchOrchestrator}. Transitions only move
 * forward.
 */
public enum RunState {
    NOT_STARTED,
    RUNNING,
    DONE
}
