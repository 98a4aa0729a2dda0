package de.bsommerfeld.workbench.prefetch;

/**
 * Events published by the prefetch layer.
 */
public class PrefetchEvents {

    /**
     * Fired once, when the startup prefetch has worked through both tiers.
     */
    public record PrefetchFinishedEvent(PrefetchReport report) {
    }
}
