package de.bsommerfeld.workbench.prefetch;

import com.google.common.eventbus.Subscribe;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.core.event.ApplicationEventBus;
import de.bsommerfeld.workbench.prefetch.PrefetchEvents.PrefetchFinishedEvent;
import de.bsommerfeld.workbench.workspace.WorkspaceException;
import de.bsommerfeld.workbench.workspace.WorktreeLister;
import de.bsommerfeld.workbench.workspace.git.GitStatusFetcher;
import de.bsommerfeld.workbench.workspace.session.SessionPrefetcher;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.AbstractSet;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Drives the orchestrator against mocked fetchers. Unless a test overrides
 * it, every call succeeds immediately and each project has one worktree with
 * id {@code <projectId>-wt}.
 */
@ExtendWith(MockitoExtension.class)
class StartupPrefetchOrchestratorTest {

    private static final Project A = Project.of("a", "alpha", "/a");
    private static final Project B = Project.folder("b", "Group");
    private static final Project C = Project.of("c", "gamma", "/c");
    private static final Project D = Project.of("d", "delta", "/d");
    private static final Project E = Project.of("e", "epsilon", "/e");

    @Mock
    private GitStatusFetcher gitStatusFetcher;
    @Mock
    private WorktreeLister worktreeLister;
    @Mock
    private SessionPrefetcher sessionPrefetcher;

    private ApplicationEventBus eventBus;
    private final List<PrefetchFinishedEvent> finishedEvents = new ArrayList<>();

    @BeforeEach
    void setUp() {
        lenient().when(gitStatusFetcher.fetchGitStatus(anyString())).thenReturn(CompletableFuture.completedFuture(null));
        lenient().when(worktreeLister.listWorktrees(anyString()))
                .thenAnswer(inv -> CompletableFuture.completedFuture(List.of(worktreeOf(inv.getArgument(0)))));
        lenient().when(sessionPrefetcher.prefetchSessions(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(null));

        eventBus = new ApplicationEventBus();
        eventBus.register(new Object() {
            @Subscribe
            public void on(PrefetchFinishedEvent event) {
                finishedEvents.add(event);
            }
        });
    }

    private static Worktree worktreeOf(String projectId) {
        return new Worktree(projectId + "-wt", projectId, projectId + " main", "/wt/" + projectId, "main");
    }

    private StartupPrefetchOrchestrator orchestrator(int priorityLimit, int backgroundLimit) {
        return new StartupPrefetchOrchestrator(gitStatusFetcher, worktreeLister, sessionPrefetcher, eventBus,
                priorityLimit, backgroundLimit);
    }

    private static PrefetchReport await(CompletableFuture<PrefetchReport> future) throws Exception {
        return future.get(5, TimeUnit.SECONDS);
    }

    @Test
    void run_allSucceed_shouldWarmEveryProjectAndWorktree() throws Exception {
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        PrefetchReport report = await(orchestrator.run(List.of(A, B, C, D, E), Set.of("a", "e")));

        for (String id : List.of("a", "c", "d", "e")) {
            verify(gitStatusFetcher).fetchGitStatus(id);
            verify(worktreeLister).listWorktrees(id);
            verify(sessionPrefetcher).prefetchSessions(id + "-wt", "/wt/" + id);
        }
        assertEquals(2, report.priorityProjects());
        assertEquals(2, report.backgroundProjects());
        assertEquals(12, report.succeeded());
        assertTrue(report.failures().isEmpty());
        assertEquals(RunState.DONE, orchestrator.getState());
    }

    @Test
    void run_shouldFinishPriorityTierBeforeBackgroundStarts() throws Exception {
        CompletableFuture<Void> slowStatus = new CompletableFuture<>();
        when(gitStatusFetcher.fetchGitStatus("e")).thenReturn(slowStatus);
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        CompletableFuture<PrefetchReport> completion = orchestrator.run(List.of(A, C, D, E), Set.of("a", "e"));

        verify(gitStatusFetcher).fetchGitStatus("a");
        verify(sessionPrefetcher).prefetchSessions("e-wt", "/wt/e");
        verify(gitStatusFetcher, never()).fetchGitStatus("c");
        verify(worktreeLister, never()).listWorktrees("d");
        assertEquals(RunState.RUNNING, orchestrator.getState());
        assertFalse(completion.isDone());

        slowStatus.complete(null);

        await(completion);
        InOrder order = inOrder(gitStatusFetcher);
        order.verify(gitStatusFetcher).fetchGitStatus("e");
        order.verify(gitStatusFetcher).fetchGitStatus("c");
        verify(gitStatusFetcher).fetchGitStatus("d");
    }

    @Test
    void run_shouldRespectChunkLimitWithinTier() throws Exception {
        CompletableFuture<Void> slowStatus = new CompletableFuture<>();
        when(gitStatusFetcher.fetchGitStatus("c")).thenReturn(slowStatus);
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 2);

        CompletableFuture<PrefetchReport> completion = orchestrator.run(List.of(A, C, D, E), Set.of());

        verify(gitStatusFetcher).fetchGitStatus("a");
        verify(gitStatusFetcher).fetchGitStatus("c");
        verify(gitStatusFetcher, never()).fetchGitStatus("d");

        slowStatus.complete(null);

        await(completion);
        verify(gitStatusFetcher).fetchGitStatus("d");
        verify(gitStatusFetcher).fetchGitStatus("e");
    }

    @Test
    void run_gitStatusFailure_shouldBeIsolatedAndRecorded() throws Exception {
        when(gitStatusFetcher.fetchGitStatus("c"))
                .thenReturn(CompletableFuture.failedFuture(new CompletionException(new IOException("not a repo"))));
        when(worktreeLister.listWorktrees("c")).thenReturn(CompletableFuture.completedFuture(List.of(
                new Worktree("c1", "c", "one", "/wt/c1", "main"),
                new Worktree("c2", "c", "two", "/wt/c2", "feature"))));

        PrefetchReport report = await(orchestrator(3, 1).run(List.of(A, B, C, D, E), Set.of("a", "e")));

        verify(sessionPrefetcher).prefetchSessions("c1", "/wt/c1");
        verify(sessionPrefetcher).prefetchSessions("c2", "/wt/c2");
        verify(gitStatusFetcher).fetchGitStatus("d");
        verify(sessionPrefetcher).prefetchSessions("d-wt", "/wt/d");

        assertEquals(1, report.failures().size());
        FetchFailure failure = report.failures().get(0);
        assertEquals(EntityKind.PROJECT, failure.entityKind());
        assertEquals("c", failure.entityId());
        assertEquals(FetchOperation.GIT_STATUS, failure.operation());
        assertInstanceOf(IOException.class, failure.cause());
        assertEquals(List.of(failure), report.failuresFor("c"));
    }

    @Test
    void run_worktreeListingFailure_shouldNotBlockGitStatus() throws Exception {
        when(worktreeLister.listWorktrees("c"))
                .thenReturn(CompletableFuture.failedFuture(WorkspaceException.notFound("project c vanished")));

        PrefetchReport report = await(orchestrator(3, 3).run(List.of(C, D), Set.of()));

        verify(gitStatusFetcher).fetchGitStatus("c");
        verify(sessionPrefetcher, never()).prefetchSessions(eq("c-wt"), anyString());
        assertEquals(1, report.failures().size());
        assertEquals(FetchOperation.LIST_WORKTREES, report.failures().get(0).operation());
        assertInstanceOf(WorkspaceException.class, report.failures().get(0).cause());
    }

    @Test
    void run_sessionFailure_shouldBeRecordedAgainstWorktree() throws Exception {
        when(sessionPrefetcher.prefetchSessions("d-wt", "/wt/d"))
                .thenReturn(CompletableFuture.failedFuture(new IOException("index unreadable")));

        PrefetchReport report = await(orchestrator(3, 3).run(List.of(C, D), Set.of()));

        assertEquals(1, report.failures().size());
        FetchFailure failure = report.failures().get(0);
        assertEquals(EntityKind.WORKTREE, failure.entityKind());
        assertEquals("d-wt", failure.entityId());
        assertEquals(5, report.succeeded());
    }

    @Test
    void run_synchronousThrow_shouldBeIsolated() throws Exception {
        when(gitStatusFetcher.fetchGitStatus("a")).thenThrow(new IllegalStateException("not started"));

        PrefetchReport report = await(orchestrator(1, 1).run(List.of(A, C), Set.of("a")));

        verify(sessionPrefetcher).prefetchSessions("a-wt", "/wt/a");
        verify(gitStatusFetcher).fetchGitStatus("c");
        assertEquals(1, report.failures().size());
        assertInstanceOf(IllegalStateException.class, report.failures().get(0).cause());
    }

    @Test
    void run_emptyWorktreeList_shouldSkipSessions() throws Exception {
        when(worktreeLister.listWorktrees("c")).thenReturn(CompletableFuture.completedFuture(List.of()));

        PrefetchReport report = await(orchestrator(3, 3).run(List.of(C), Set.of()));

        verify(sessionPrefetcher, never()).prefetchSessions(anyString(), anyString());
        assertEquals(2, report.succeeded());
    }

    @Test
    void run_calledTwice_shouldExecuteOnceAndShareFuture() throws Exception {
        CompletableFuture<Void> slowStatus = new CompletableFuture<>();
        when(gitStatusFetcher.fetchGitStatus("a")).thenReturn(slowStatus);
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        CompletableFuture<PrefetchReport> first = orchestrator.run(List.of(A), Set.of("a"));
        CompletableFuture<PrefetchReport> second = orchestrator.run(List.of(A, C), Set.of());
        slowStatus.complete(null);
        await(first);
        CompletableFuture<PrefetchReport> third = orchestrator.run(List.of(C), Set.of());

        assertSame(first, second);
        assertSame(first, third);
        verify(gitStatusFetcher, times(1)).fetchGitStatus("a");
        verify(gitStatusFetcher, never()).fetchGitStatus("c");
        assertEquals(1, finishedEvents.size());
    }

    @Test
    void run_onlyFolders_shouldCompleteWithEmptyReport() throws Exception {
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        PrefetchReport report = await(orchestrator.run(List.of(B, Project.folder("x", "Other")), Set.of("b")));

        verifyNoInteractions(gitStatusFetcher, worktreeLister, sessionPrefetcher);
        assertEquals(0, report.priorityProjects() + report.backgroundProjects());
        assertEquals(0, report.succeeded());
        assertEquals(RunState.DONE, orchestrator.getState());
    }

    @Test
    void run_entryWithoutId_shouldBeSkippedAndRunShouldFinish() throws Exception {
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        PrefetchReport report = await(orchestrator.run(List.of(Project.of(null, "nameless", "/n"), C),
                Set.copyOf(Set.of("a"))));

        verify(gitStatusFetcher).fetchGitStatus("c");
        verify(gitStatusFetcher, times(1)).fetchGitStatus(any());
        assertEquals(1, report.backgroundProjects());
        assertEquals(RunState.DONE, orchestrator.getState());
    }

    @Test
    void run_failureWhileStarting_shouldStillCompleteAndReleaseLaterTriggers() throws Exception {
        Set<String> brokenSnapshot = new AbstractSet<>() {
            @Override
            public boolean contains(Object o) {
                throw new IllegalStateException("snapshot unavailable");
            }

            @Override
            public Iterator<String> iterator() {
                return Collections.emptyIterator();
            }

            @Override
            public int size() {
                return 0;
            }
        };
        StartupPrefetchOrchestrator orchestrator = orchestrator(3, 3);

        PrefetchReport report = await(orchestrator.run(List.of(A, C), brokenSnapshot));

        assertEquals(RunState.DONE, orchestrator.getState());
        assertEquals(0, report.priorityProjects() + report.backgroundProjects());
        assertEquals(1, finishedEvents.size());
        assertTrue(orchestrator.run(List.of(A), Set.of()).isDone());
        verifyNoInteractions(gitStatusFetcher, worktreeLister, sessionPrefetcher);
    }

    @Test
    void run_shouldPostFinishedEventWithReport() throws Exception {
        PrefetchReport report = await(orchestrator(3, 3).run(List.of(A), Set.of()));

        assertEquals(1, finishedEvents.size());
        assertSame(report, finishedEvents.get(0).report());
    }

    @Test
    void constructor_shouldResolveLimitsFromConfig() throws Exception {
        GlobalConfig config = new GlobalConfig();
        config.getPrefetch().setConcurrencyLimit(1);
        CompletableFuture<Void> slowStatus = new CompletableFuture<>();
        when(gitStatusFetcher.fetchGitStatus("a")).thenReturn(slowStatus);
        StartupPrefetchOrchestrator orchestrator = new StartupPrefetchOrchestrator(gitStatusFetcher,
                worktreeLister, sessionPrefetcher, eventBus, config);

        CompletableFuture<PrefetchReport> completion = orchestrator.run(List.of(A, C), Set.of());

        verify(gitStatusFetcher, never()).fetchGitStatus("c");
        slowStatus.complete(null);
        await(completion);
        verify(gitStatusFetcher).fetchGitStatus("c");
    }

    @Test
    void constructor_shouldRejectLimitBelowOne() {
        assertThrows(IllegalArgumentException.class, () -> orchestrator(0, 3));
        assertThrows(IllegalArgumentException.class, () -> orchestrator(3, 0));
    }
}
