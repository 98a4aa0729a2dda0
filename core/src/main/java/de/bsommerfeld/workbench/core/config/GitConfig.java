package de.bsommerfeld.workbench.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyDescription;

@JsonIgnoreProperties(ignoreUnknown = true)
public class GitConfig {

    @JsonProperty("executable")
    @JsonPropertyDescription("Git binary used for status queries (default: git)")
    private String executable = "git";

    @JsonProperty("command-timeout-seconds")
    @JsonPropertyDescription("Seconds before a single git process is abandoned (default: 15)")
    private long commandTimeoutSeconds = 15;

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public long getCommandTimeoutSeconds() {
        return commandTimeoutSeconds;
    }

    public void setCommandTimeoutSeconds(long commandTimeoutSeconds) {
        this.commandTimeoutSeconds = commandTimeoutSeconds;
    }
}
