package de.bsommerfeld.workbench.workspace;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.workbench.core.config.GlobalConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared pool for blocking workspace I/O: reading projects.json and session
 * indexes, waiting on git processes. Callers get {@code CompletableFuture}s
 * and never block on this pool themselves.
 *
 * <p>
 * Threads are daemons so a stalled git process cannot keep the JVM alive.
 */
@Singleton
public class WorkspaceExecutor implements Executor {

    private static final Logger LOG = LoggerFactory.getLogger(WorkspaceExecutor.class);

    private final ExecutorService pool;

    @Inject
    public WorkspaceExecutor(GlobalConfig config) {
        this(Math.max(1, config.getPrefetch().getIoThreads()));
    }

    public WorkspaceExecutor(int threads) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory factory = r -> {
            Thread t = new Thread(r, "workspace-io-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
        this.pool = Executors.newFixedThreadPool(threads, factory);
    }

    @Override
    public void execute(Runnable command) {
        pool.execute(command);
    }

    /**
     * Lets queued reads finish (up to 10s), then interrupts whatever is left.
     */
    public void shutdown() {
        LOG.info("Shutting down workspace I/O pool...");
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                pool.shutdownNow();
                LOG.warn("Workspace I/O pool forced shutdown (timed out).");
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
