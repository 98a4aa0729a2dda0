package de.bsommerfeld.workbench.prefetch;

import com.google.common.collect.Lists;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Runs an asynchronous task per item in consecutive chunks of at most
 * {@code limit} items. All tasks of a chunk are started together; the next
 * chunk starts only after every task of the current one has resolved.
 *
 * <p>
 * A slow task therefore holds back the following chunk. The point is a hard
 * upper bound on in-flight work with a simple barrier, not throughput.
 *
 * <p>
 * Tasks are expected to handle their own failures. A task that still fails
 * (or throws while being started) is logged and counts as resolved, so it can
 * never stall or break the chain for later chunks.
 */
public final class ChunkedTaskRunner {

    private static final Logger LOG = LoggerFactory.getLogger(ChunkedTaskRunner.class);

    private ChunkedTaskRunner() {
    }

    /**
     * @param items ordered items; copied, later changes to the list are not seen
     * @param limit maximum chunk size, at least 1
     * @param task  starts the work for one item
     * @return future completing after the last chunk has resolved; never fails
     * @throws IllegalArgumentException if {@code limit < 1}
     */
    public static <T> CompletableFuture<Void> runInChunks(List<T> items, int limit,
            Function<? super T, ? extends CompletableFuture<?>> task) {
        if (limit < 1)
            throw new IllegalArgumentException("Concurrency limit must be at least 1, was " + limit);

        CompletableFuture<Void> chain = CompletableFuture.completedFuture(null);
        for (List<T> chunk : Lists.partition(List.copyOf(items), limit)) {
            chain = chain.thenCompose(ignored -> runChunk(chunk, task));
        }
        return chain;
    }

    private static <T> CompletableFuture<Void> runChunk(List<T> chunk,
            Function<? super T, ? extends CompletableFuture<?>> task) {
        CompletableFuture<?>[] running = new CompletableFuture<?>[chunk.size()];
        for (int i = 0; i < chunk.size(); i++) {
            T item = chunk.get(i);
            running[i] = start(item, task).handle((result, error) -> {
                if (error != null)
                    LOG.error("Chunk task for {} failed without handling its error", item, error);
                return null;
            });
        }
        return CompletableFuture.allOf(running);
    }

    private static <T> CompletableFuture<?> start(T item, Function<? super T, ? extends CompletableFuture<?>> task) {
        try {
            CompletableFuture<?> future = task.apply(item);
            return future != null ? future : CompletableFuture.completedFuture(null);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
