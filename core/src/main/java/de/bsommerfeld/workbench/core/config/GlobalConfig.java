package de.bsommerfeld.workbench.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

/**
 * Workbench - Global Configuration. Root of config.toml; each nested object
 * becomes its own TOML table.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class GlobalConfig {

    @JsonProperty("debug-mode")
    @JsonPropertyDescription("Enable detailed debug logging")
    private boolean debugMode = false;

    @JsonProperty("prefetch")
    @JsonPropertyDescription("Startup cache warming")
    private PrefetchConfig prefetch = new PrefetchConfig();

    @JsonProperty("git")
    @JsonPropertyDescription("Git integration")
    private GitConfig git = new GitConfig();

    public boolean isDebugMode() {
        return debugMode;
    }

    public void setDebugMode(boolean debugMode) {
        this.debugMode = debugMode;
    }

    public PrefetchConfig getPrefetch() {
        return prefetch;
    }

    public GitConfig getGit() {
        return git;
    }
}
