package org.burrow.rabbit.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * A dedicated, supervised thread with an explicit start/shutdown protocol.
 *
 * <p>The loop receives two tokens: {@code stopRequested} asks it to finish its current work
 * and exit, {@code forcedStop} tells it to abandon whatever it is doing. Shutdown cancels
 * the first, waits up to the timeout for the thread to exit, then cancels the second and
 * waits one more grace period.</p>
 *
 * <pre>
 * STOPPED --start()--&gt; RUNNING --shutdown()--&gt; STOPPING --&gt; STOPPED
 * </pre>
 */
public final class BackgroundWorker {

    private static final Logger log = LoggerFactory.getLogger(BackgroundWorker.class);

    public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration FORCED_STOP_GRACE = Duration.ofSeconds(1);

    /**
     * Body of the worker thread.
     */
    @FunctionalInterface
    public interface Loop {
        void run(CancellationToken stopRequested, CancellationToken forcedStop);
    }

    private final String threadName;
    private final Loop loop;
    private final Duration grace;

    private volatile WorkerState state = WorkerState.STOPPED;
    private volatile boolean forcedStopSet;
    private volatile Thread thread;
    private CancellationToken stopRequested;
    private CancellationToken forcedStop;

    public BackgroundWorker(String threadName, Loop loop) {
        this(threadName, loop, FORCED_STOP_GRACE);
    }

    public BackgroundWorker(String threadName, Loop loop, Duration grace) {
        this.threadName = threadName;
        this.loop = loop;
        this.grace = grace;
    }

    /**
     * Start the worker thread.
     *
     * @return false if it was already running
     */
    public synchronized boolean start() {
        if (state != WorkerState.STOPPED) {
            log.warn("Worker {} is already {}", threadName, state);
            return false;
        }
        stopRequested = new CancellationToken();
        forcedStop = new CancellationToken();
        forcedStopSet = false;

        CancellationToken stop = stopRequested;
        CancellationToken force = forcedStop;
        thread = new Thread(() -> runLoop(stop, force), threadName);
        thread.setDaemon(true);
        state = WorkerState.RUNNING;
        thread.start();
        log.debug("Worker {} started", threadName);
        return true;
    }

    /**
     * Ask the loop to finish and wait for it.
     *
     * <p>Idempotent. A second call made while the first is still in progress blocks until
     * that one completes, then returns.</p>
     *
     * @return true if the loop exited on its own, false if it had to be forced
     */
    public synchronized boolean shutdown(Duration timeout) {
        if (state == WorkerState.STOPPED) {
            return !forcedStopSet;
        }
        state = WorkerState.STOPPING;
        stopRequested.cancel();

        boolean clean = true;
        try {
            thread.join(Math.max(1, timeout.toMillis()));
            if (thread.isAlive()) {
                clean = false;
                log.warn("Worker {} did not stop within {} ms, forcing stop", threadName, timeout.toMillis());
                forcedStopSet = true;
                forcedStop.cancel();
                thread.join(Math.max(1, grace.toMillis()));
                if (thread.isAlive()) {
                    log.error("Worker {} is still alive after forced stop", threadName);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            forcedStopSet = true;
            forcedStop.cancel();
            clean = false;
        } finally {
            state = WorkerState.STOPPED;
        }
        log.debug("Worker {} stopped (clean={})", threadName, clean);
        return clean;
    }

    public WorkerState state() {
        return state;
    }

    /**
     * @return true if the last shutdown had to force the loop to stop
     */
    public boolean isForcedStop() {
        return forcedStopSet;
    }

    public boolean isAlive() {
        Thread t = thread;
        return t != null && t.isAlive();
    }

    private void runLoop(CancellationToken stop, CancellationToken force) {
        try {
            loop.run(stop, force);
        } catch (RuntimeException e) {
            log.error("Worker {} terminated unexpectedly: {}", threadName, e.getMessage(), e);
        }
    }
}
