package de.bsommerfeld.workbench.workspace;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.core.event.ApplicationEventBus;
import de.bsommerfeld.workbench.core.event.ControlEvents.ProjectsChangedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Single point of access to the project index for the rest of the
 * application. Neither the prefetch layer nor the shell talk to
 * {@link WorkspaceService} directly.
 *
 * <h3>Threading model</h3>
 * <ul>
 * <li>{@link #listProjects()} serves the last loaded list and never touches
 * the store; {@link #reload()} refreshes it.</li>
 * <li>{@link #listWorktrees(String)} runs on the {@link WorkspaceExecutor};
 * store failures surface as a failed future, never as a throw on the
 * caller's thread.</li>
 * </ul>
 */
@Singleton
public class WorkspaceRepository implements ProjectIndex, WorktreeLister {

    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceRepository.class);

    private final WorkspaceService workspaceService;
    private final WorkspaceExecutor executor;
    private final ApplicationEventBus eventBus;

    private volatile List<Project> projects = List.of();

    @Inject
    public WorkspaceRepository(WorkspaceService workspaceService, WorkspaceExecutor executor,
            ApplicationEventBus eventBus) {
        this.workspaceService = workspaceService;
        this.executor = executor;
        this.eventBus = eventBus;
    }

    /**
     * Loads the project list from the store and announces it with a
     * {@link ProjectsChangedEvent}. A failed load keeps the previous list and
     * announces nothing.
     *
     * @return future completing with the freshly loaded list
     */
    public CompletableFuture<List<Project>> reload() {
        return CompletableFuture.supplyAsync(workspaceService::getProjects, executor)
                .thenApply(loaded -> {
                    projects = List.copyOf(loaded);
                    LOG.info("Loaded {} workspace entries", loaded.size());
                    eventBus.post(new ProjectsChangedEvent(projects));
                    return projects;
                })
                .whenComplete((loaded, error) -> {
                    if (error != null)
                        LOG.error("Failed to load project index", error);
                });
    }

    @Override
    public List<Project> listProjects() {
        return projects;
    }

    @Override
    public CompletableFuture<List<Worktree>> listWorktrees(String projectId) {
        return CompletableFuture.supplyAsync(() -> workspaceService.getWorktrees(projectId), executor);
    }
}
