package org.burrow.rabbit.lifecycle;

import java.io.Closeable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Supplier;

/**
 * Runs the {@code *Async} variants of blocking calls off the caller's thread.
 *
 * <p>Uses the executor given with {@link #setExecutor(Executor)} if there is one, otherwise
 * a single daemon thread created on first use and owned by this runner. Only the owned
 * thread is shut down by {@link #close()}. Once closed, tasks are not run and the
 * returned future completes with the fallback value.</p>
 */
public final class AsyncRunner implements Closeable {

    private final String threadName;
    private Executor executor;
    private ExecutorService owned;
    private boolean closed;

    public AsyncRunner(String threadName) {
        this.threadName = threadName;
    }

    /**
     * Use a caller-managed executor instead of the owned thread.
     */
    public synchronized void setExecutor(Executor executor) {
        this.executor = executor;
    }

    public synchronized <R> CompletableFuture<R> supply(Supplier<R> task, R whenClosed) {
        if (closed) {
            return CompletableFuture.completedFuture(whenClosed);
        }
        return CompletableFuture.supplyAsync(task, executor());
    }

    @Override
    public synchronized void close() {
        closed = true;
        if (owned != null) {
            owned.shutdown();
        }
    }

    private Executor executor() {
        if (executor != null) {
            return executor;
        }
        if (owned == null) {
            owned = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, threadName);
                t.setDaemon(true);
                return t;
            });
        }
        return owned;
    }
}
