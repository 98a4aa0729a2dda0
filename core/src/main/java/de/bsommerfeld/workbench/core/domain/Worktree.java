package de.bsommerfeld.workbench.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A git worktree checked out for a project.
 *
 * @param id        stable identifier, also the key of the session cache
 * @param projectId owning project
 * @param name      display name
 * @param path      checkout directory
 * @param branch    branch the worktree was created on
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Worktree(
        @JsonProperty("id") String id,
        @JsonProperty("project_id") String projectId,
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("branch") String branch) {
}
