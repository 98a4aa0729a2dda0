package de.bsommerfeld.workbench.prefetch;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import de.bsommerfeld.workbench.core.domain.Project;
import de.bsommerfeld.workbench.core.domain.Worktree;
import de.bsommerfeld.workbench.core.event.ApplicationEventBus;
import de.bsommerfeld.workbench.prefetch.PrefetchEvents.PrefetchFinishedEvent;
import de.bsommerfeld.workbench.workspace.WorktreeLister;
import de.bsommerfeld.workbench.workspace.git.GitStatusFetcher;
import de.bsommerfeld.workbench.workspace.session.SessionPrefetcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

/**
 * Warms the git status and session caches once the project list is first
 * available.
 *
 * <h3>Order of work</h3>
 * <ol>
 * <li>Projects are split into the expanded (priority) tier and the rest; folders
 * are skipped.</li>
 * <li>Each tier is processed in chunks of its concurrency limit. The priority
 * tier is fully drained before the first background chunk starts.</li>
 * <li>Per project, the git status fetch and the worktree listing start
 * together; once the listing is in, sessions of all its worktrees are
 * prefetched in parallel.</li>
 * </ol>
 *
 * <h3>Failures</h3>
 * Every leaf call is isolated: a failure is logged, recorded in the
 * {@link PrefetchReport} and otherwise ignored. There are no retries, and the
 * run as a whole cannot fail.
 *
 * <h3>Run once</h3>
 * Only the first {@link #run} call does anything. Later calls return the
 * future of that first run, whether it is still in flight or finished.
 */
@Singleton
public class StartupPrefetchOrchestrator {

    private static final Logger LOG = LoggerFactory.getLogger(StartupPrefetchOrchestrator.class);

    private final GitStatusFetcher gitStatusFetcher;
    private final WorktreeLister worktreeLister;
    private final SessionPrefetcher sessionPrefetcher;
    private final ApplicationEventBus eventBus;
    private final int priorityLimit;
    private final int backgroundLimit;

    private final RunGuard guard = new RunGuard();
    private final CompletableFuture<PrefetchReport> completion = new CompletableFuture<>();

    @Inject
    public StartupPrefetchOrchestrator(GitStatusFetcher gitStatusFetcher, WorktreeLister worktreeLister,
            SessionPrefetcher sessionPrefetcher, ApplicationEventBus eventBus, GlobalConfig config) {
        this(gitStatusFetcher, worktreeLister, sessionPrefetcher, eventBus,
                config.getPrefetch().resolvePriorityLimit(), config.getPrefetch().resolveBackgroundLimit());
    }

    public StartupPrefetchOrchestrator(GitStatusFetcher gitStatusFetcher, WorktreeLister worktreeLister,
            SessionPrefetcher sessionPrefetcher, ApplicationEventBus eventBus, int priorityLimit,
            int backgroundLimit) {
        if (priorityLimit < 1 || backgroundLimit < 1)
            throw new IllegalArgumentException(
                    "Concurrency limits must be at least 1, were " + priorityLimit + "/" + backgroundLimit);
        this.gitStatusFetcher = gitStatusFetcher;
        this.worktreeLister = worktreeLister;
        this.sessionPrefetcher = sessionPrefetcher;
        this.eventBus = eventBus;
        this.priorityLimit = priorityLimit;
        this.backgroundLimit = backgroundLimit;
    }

    /**
     * Starts the prefetch for the given projects, unless a run was already
     * started.
     *
     * @param projects    the project index, folders included
     * @param expandedIds snapshot of expanded project ids; later expansion
     *                    changes do not move projects between tiers
     * @return future of the one and only run; never completes exceptionally
     */
    public CompletableFuture<PrefetchReport> run(List<Project> projects, Set<String> expandedIds) {
        if (!guard.tryStart()) {
            LOG.debug("[startup] Prefetch already {}, ignoring trigger", guard.state());
            return completion;
        }

        long startNanos = System.nanoTime();
        OutcomeRecorder recorder = new OutcomeRecorder();
        try {
            start(PriorityPartitioner.partition(projects, expandedIds), recorder, startNanos);
        } catch (RuntimeException e) {
            // The latch is already taken; completing here keeps later triggers from waiting forever
            LOG.error("[startup] Failed to start prefetch", e);
            finish(recorder.toReport(new PrefetchTiers(List.of(), List.of()),
                    Duration.ofNanos(System.nanoTime() - startNanos)));
        }
        return completion;
    }

    private void start(PrefetchTiers tiers, OutcomeRecorder recorder, long startNanos) {
        LOG.info("[startup] Fetching worktree status and sessions: expanded={}, collapsed={}",
                tiers.priority().size(), tiers.background().size());

        ChunkedTaskRunner.runInChunks(tiers.priority(), priorityLimit, p -> prefetchProject(p, recorder))
                .thenCompose(v -> ChunkedTaskRunner.runInChunks(tiers.background(), backgroundLimit,
                        p -> prefetchProject(p, recorder)))
                .whenComplete((v, error) -> {
                    if (error != null)
                        LOG.error("[startup] Prefetch chain ended unexpectedly", error);
                    finish(recorder.toReport(tiers, Duration.ofNanos(System.nanoTime() - startNanos)));
                });
    }

    public RunState getState() {
        return guard.state();
    }

    /**
     * Future of the one run; stays pending until {@link #run} was called and
     * has worked through both tiers.
     */
    public CompletableFuture<PrefetchReport> completion() {
        return completion;
    }

    private void finish(PrefetchReport report) {
        guard.markDone();
        if (report.failures().isEmpty()) {
            LOG.info("[startup] Done fetching worktree status and sessions for all projects in {} ms",
                    report.elapsed().toMillis());
        } else {
            LOG.info("[startup] Done fetching worktree status and sessions in {} ms ({} of {} calls failed)",
                    report.elapsed().toMillis(), report.failures().size(),
                    report.failures().size() + report.succeeded());
        }
        try {
            eventBus.post(new PrefetchFinishedEvent(report));
        } finally {
            completion.complete(report);
        }
    }

    /**
     * Chunk-level task for one project. Resolves once its git status and all of
     * its session prefetches have resolved.
     */
    private CompletableFuture<Void> prefetchProject(Project project, OutcomeRecorder recorder) {
        CompletableFuture<Void> status = isolate(FetchOperation.GIT_STATUS, project.id(),
                () -> gitStatusFetcher.fetchGitStatus(project.id()), recorder);

        CompletableFuture<Void> sessions = isolate(FetchOperation.LIST_WORKTREES, project.id(),
                () -> worktreeLister.listWorktrees(project.id()), recorder)
                .thenCompose(worktrees -> worktrees == null
                        ? CompletableFuture.<Void>completedFuture(null)
                        : prefetchWorktrees(worktrees, recorder));

        return CompletableFuture.allOf(status, sessions);
    }

    private CompletableFuture<Void> prefetchWorktrees(List<Worktree> worktrees, OutcomeRecorder recorder) {
        CompletableFuture<?>[] running = worktrees.stream()
                .map(w -> isolate(FetchOperation.PREFETCH_SESSIONS, w.id(),
                        () -> sessionPrefetcher.prefetchSessions(w.id(), w.path()), recorder))
                .toArray(CompletableFuture<?>[]::new);
        return CompletableFuture.allOf(running);
    }

    /**
     * Runs one leaf call and turns any failure, synchronous or asynchronous,
     * into a recorded outcome.
     *
     * @return future of the call's value, or of {@code null} if it failed;
     *         never completes exceptionally
     */
    private <T> CompletableFuture<T> isolate(FetchOperation operation, String entityId,
            Supplier<CompletableFuture<T>> call, OutcomeRecorder recorder) {
        CompletableFuture<T> future;
        try {
            future = call.get();
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }

        return future.handle((value, error) -> {
            if (error == null) {
                recorder.record(TaskOutcome.success(operation, entityId));
                return value;
            }
            Throwable cause = unwrap(error);
            LOG.warn("[startup] Failed to {} for {} {}: {}", operation.description(),
                    operation.entityKind().name().toLowerCase(), entityId, cause.toString());
            LOG.debug("[startup] Failure detail for {}", entityId, cause);
            recorder.record(TaskOutcome.failure(FetchFailure.of(operation, entityId, cause)));
            return null;
        });
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
