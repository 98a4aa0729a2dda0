package de.bsommerfeld.workbench.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Startup prefetch parameters. Values are persisted in config.toml
 * and loaded at startup.
 *
 * <p>
 * The per-tier limits fall back to {@link #getConcurrencyLimit()} when left
 * at {@code 0}, so the common case only needs the global value. Values below
 * that range are replaced by their fallback with a warning.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class PrefetchConfig {

    private static final Logger LOG = LoggerFactory.getLogger(PrefetchConfig.class);

    public static final int DEFAULT_CONCURRENCY_LIMIT = 3;

    @JsonProperty("enabled")
    @JsonPropertyDescription("Warm git status and session caches on startup (default: true)")
    private boolean enabled = true;

    @JsonProperty("concurrency-limit")
    @JsonPropertyDescription("Projects fetched concurrently per chunk (default: 3)")
    private int concurrencyLimit = DEFAULT_CONCURRENCY_LIMIT;

    @JsonProperty("priority-concurrency-limit")
    @JsonPropertyDescription("Chunk size for expanded projects, 0 = use concurrency-limit (default: 0)")
    private int priorityConcurrencyLimit = 0;

    @JsonProperty("background-concurrency-limit")
    @JsonPropertyDescription("Chunk size for collapsed projects, 0 = use concurrency-limit (default: 0)")
    private int backgroundConcurrencyLimit = 0;

    @JsonProperty("io-threads")
    @JsonPropertyDescription("Worker threads for blocking workspace I/O (default: 8)")
    private int ioThreads = 8;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public int getConcurrencyLimit() {
        return concurrencyLimit;
    }

    public void setConcurrencyLimit(int concurrencyLimit) {
        this.concurrencyLimit = concurrencyLimit;
    }

    public int getPriorityConcurrencyLimit() {
        return priorityConcurrencyLimit;
    }

    public void setPriorityConcurrencyLimit(int priorityConcurrencyLimit) {
        this.priorityConcurrencyLimit = priorityConcurrencyLimit;
    }

    public int getBackgroundConcurrencyLimit() {
        return backgroundConcurrencyLimit;
    }

    public void setBackgroundConcurrencyLimit(int backgroundConcurrencyLimit) {
        this.backgroundConcurrencyLimit = backgroundConcurrencyLimit;
    }

    public int getIoThreads() {
        return ioThreads;
    }

    public void setIoThreads(int ioThreads) {
        this.ioThreads = ioThreads;
    }

    /**
     * Chunk size for the priority tier after applying the global fallback.
     */
    public int resolvePriorityLimit() {
        return resolve("priority-concurrency-limit", priorityConcurrencyLimit);
    }

    /**
     * Chunk size for the background tier after applying the global fallback.
     */
    public int resolveBackgroundLimit() {
        return resolve("background-concurrency-limit", backgroundConcurrencyLimit);
    }

    private int resolve(String tierKey, int tierLimit) {
        if (tierLimit > 0)
            return tierLimit;
        if (tierLimit < 0)
            LOG.warn("Invalid prefetch.{} = {}, using concurrency-limit instead", tierKey, tierLimit);
        if (concurrencyLimit > 0)
            return concurrencyLimit;
        LOG.warn("Invalid prefetch.concurrency-limit = {}, using default {}", concurrencyLimit,
                DEFAULT_CONCURRENCY_LIMIT);
        return DEFAULT_CONCURRENCY_LIMIT;
    }
}
