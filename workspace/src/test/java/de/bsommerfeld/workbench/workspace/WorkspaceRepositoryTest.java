package de.bsommerfeld.workbench.workspace;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.core.event.ApplicationEventBus;
import de.bsommerfeld.workbench.core.event.ControlEvents.ProjectsChangedEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

/**
 * Tests the async facade over {@link WorkspaceService}. The service is mocked
 * to isolate threading and event behavior.
 */
@ExtendWith(MockitoExtension.class)
class WorkspaceRepositoryTest {

    @Mock
    private WorkspaceService workspaceService;

    private WorkspaceExecutor executor;
    private ApplicationEventBus eventBus;
    private WorkspaceRepository repository;

    @BeforeEach
    void setUp() {
        executor = new WorkspaceExecutor(2);
        eventBus = new ApplicationEventBus();
        repository = new WorkspaceRepository(workspaceService, executor, eventBus);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
    }

    @Test
    void listProjects_shouldBeEmptyBeforeReload() {
        assertTrue(repository.listProjects().isEmpty());
        verifyNoInteractions(workspaceService);
    }

    @Test
    void reload_shouldCacheProjectsAndAnnounceThem() throws Exception {
        List<Project> projects = List.of(Project.of("a", "alpha", "/a"), Project.folder("f", "Group"));
        when(workspaceService.getProjects()).thenReturn(projects);
        var received = new AtomicReference<ProjectsChangedEvent>();
        eventBus.register(new Object() {
            @Subscribe
            public void on(ProjectsChangedEvent event) {
                received.set(event);
            }
        });

        repository.reload().get(5, TimeUnit.SECONDS);

        assertEquals(projects, repository.listProjects());
        assertNotNull(received.get());
        assertEquals(projects, received.get().projects());
    }

    @Test
    void reload_shouldKeepPreviousListOnFailure() throws Exception {
        when(workspaceService.getProjects())
                .thenReturn(List.of(Project.of("a", "alpha", "/a")))
                .thenThrow(new WorkspaceException(WorkspaceException.Kind.IO, "disk gone"));

        repository.reload().get(5, TimeUnit.SECONDS);
        CompletableFuture<List<Project>> second = repository.reload();

        assertThrows(ExecutionException.class, () -> second.get(5, TimeUnit.SECONDS));
        assertEquals(1, repository.listProjects().size());
    }

    @Test
    void listWorktrees_shouldDelegateToService() throws Exception {
        var worktree = new Worktree("wt", "a", "alpha", "/a", "main");
        when(workspaceService.getWorktrees("a")).thenReturn(List.of(worktree));

        assertEquals(List.of(worktree), repository.listWorktrees("a").get(5, TimeUnit.SECONDS));
    }

    @Test
    void listWorktrees_shouldFailFutureInsteadOfThrowing() {
        when(workspaceService.getWorktrees("x")).thenThrow(WorkspaceException.notFound("Unknown project: x"));

        CompletableFuture<List<Worktree>> future = repository.listWorktrees("x");

        var ex = assertThrows(ExecutionException.class, () -> future.get(5, TimeUnit.SECONDS));
        assertInstanceOf(WorkspaceException.class, ex.getCause());
    }
}
