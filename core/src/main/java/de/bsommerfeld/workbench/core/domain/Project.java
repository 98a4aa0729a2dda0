package de.bsommerfeld.workbench.core.domain;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of the workspace's project index. Either a git repository the user
 * added, or a folder that only groups other entries in the sidebar tree.
 * Folders never own worktrees.
 *
 * @param id       stable identifier
 * @param name     display name
 * @param path     repository root on disk; {@code null} for folders
 * @param isFolder whether this entry is a grouping folder
 * @param parentId id of the containing folder, {@code null} at top level
 * @param order    position among siblings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Project(
        @JsonProperty("id") String id,
        @JsonProperty("name") String name,
        @JsonProperty("path") String path,
        @JsonProperty("is_folder") boolean isFolder,
        @JsonProperty("parent_id") String parentId,
        @JsonProperty("order") int order) {

    public static Project of(String id, String name, String path) {
        return new Project(id, name, path, false, null, 0);
    }

    public static Project folder(String id, String name) {
        return new Project(id, name, null, true, null, 0);
    }
}
