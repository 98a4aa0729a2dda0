package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.util.StorageUtils;

import java.nio.file.Path;

/**
 * Layout of the files the workspace layer reads inside the application data
 * directory:
 *
 * <pre>
 *   {dataDir}/
 *   ├── projects.json                 project index (projects + worktrees)
 *   ├── ui-state.json                 persisted sidebar state
 *   └── sessions/index/{worktree}.json  session list per worktree
 * </pre>
 */
public final class WorkspacePaths {

    private final Path dataDir;

    public WorkspacePaths(Path dataDir) {
        this.dataDir = dataDir;
    }

    public Path projectsFile() {
        return dataDir.resolve("projects.json");
    }

    public Path uiStateFile() {
        return dataDir.resolve("ui-state.json");
    }

    public Path sessionIndexFile(String worktreeId) {
        return dataDir.resolve("sessions").resolve("index")
                .resolve(StorageUtils.sanitizeFileName(worktreeId) + ".json");
    }
}
