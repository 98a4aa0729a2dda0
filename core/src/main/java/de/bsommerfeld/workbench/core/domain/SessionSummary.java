package de.bsommerfeld.workbench.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Index entry of a chat session inside a worktree. Only the fields the
 * session list needs; the session body lives in its own data directory.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SessionSummary(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("order") int order) {
}
