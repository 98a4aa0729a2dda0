package de.bsommerfeld.workbench.workspace;

import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;

import java.util.List;

/**
 * Read contract for the workspace's project index. All implementations must
 * be thread-safe; {@link WorkspaceRepository} calls them from its I/O pool.
 *
 * <p>
 * Two implementations exist:
 * <ul>
 * <li>{@link JsonWorkspaceService} reads {@code projects.json} from the
 * application data directory</li>
 * <li>{@link TestWorkspaceService} serves generated projects from memory for
 * TEST mode</li>
 * </ul>
 *
 * <p>
 * Switching between implementations is done at the Guice module level.
 */
public interface WorkspaceService {

    /**
     * Returns all projects and folders in index order. An absent index is an
     * empty workspace, not an error.
     *
     * @throws WorkspaceException with {@link WorkspaceException.Kind#IO} if the
     *                            index exists but cannot be read
     */
    List<Project> getProjects();

    /**
     * Returns the worktrees owned by a project, in index order.
     *
     * @throws WorkspaceException {@link WorkspaceException.Kind#NOT_FOUND} for an
     *                            unknown id or a folder,
     *                            {@link WorkspaceException.Kind#IO} if the index
     *                            cannot be read
     */
    List<Worktree> getWorktrees(String projectId);
}
