package org.burrow.rabbit.publisher;

import org.burrow.rabbit.config.PublisherSettings;
import org.burrow.rabbit.lifecycle.BackgroundWorker;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.lifecycle.WorkerState;
import org.burrow.rabbit.routing.RoutingKeyGenerator;
import org.burrow.rabbit.serialization.MessageSerializationException;
import org.burrow.rabbit.serialization.MessageSerializer;
import org.burrow.rabbit.transport.AmqpBrokerConnection;
import org.burrow.rabbit.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Publisher that never blocks its callers on the broker.
 *
 * <p>{@code publish} only appends to an in-memory FIFO queue and returns false when the
 * queue already holds {@code maxQueueDepth} items. A single worker thread drains the queue
 * in order, retrying the item at the head every 500 ms until the broker takes it. Nothing
 * is persisted: items still queued when the process dies are lost.</p>
 *
 * <pre>
 * var publisher = new QueueingPublisher&lt;Order&gt;("orders", settings);
 * publisher.start();
 * publisher.publish(order);            // returns immediately
 * publisher.shutdown(Duration.ofSeconds(30));
 * </pre>
 */
public class QueueingPublisher<T> extends AbstractPublisher<T> {

    private static final Logger log = LoggerFactory.getLogger(QueueingPublisher.class);

    public static final Duration RETRY_DELAY = Duration.ofMillis(500);
    static final Duration POLL_INTERVAL = Duration.ofMillis(100);

    private final DirectPublisher<T> sender;
    private final Duration retryDelay;
    private final BackgroundWorker worker;

    private final Queue<QueueItem<T>> queue = new ConcurrentLinkedQueue<>();
    private final AtomicInteger depth = new AtomicInteger();
    private final Semaphore itemsAvailable = new Semaphore(0);
    /** Guards the shutdown flag and the depth check + offer pair. */
    private final Object enqueueLock = new Object();
    /** Set by shutdown, cleared by start; rejects new items in between. */
    private volatile boolean shutdownRequested;

    public QueueingPublisher(String name, PublisherSettings settings) {
        this(name, settings, ConnectionLifecycleProfile.defaults(), null, null);
    }

    public QueueingPublisher(String name, PublisherSettings settings, ConnectionLifecycleProfile profile,
                             MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator) {
        this(name, settings, profile, serializer, routingKeyGenerator,
                new AmqpBrokerConnection(settings.endpoint()), RETRY_DELAY, BackgroundWorker.FORCED_STOP_GRACE);
    }

    public QueueingPublisher(String name, PublisherSettings settings, ConnectionLifecycleProfile profile,
                             MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator,
                             BrokerConnection connection, Duration retryDelay, Duration forcedStopGrace) {
        super(name, settings, serializer, routingKeyGenerator);
        this.sender = new DirectPublisher<>(name, settings, profile, this.serializer, this.routingKeyGenerator,
                connection);
        this.retryDelay = retryDelay;
        this.worker = new BackgroundWorker("burrow-publisher-" + name, this::drain, forcedStopGrace);
    }

    @Override
    public void start() {
        synchronized (enqueueLock) {
            shutdownRequested = false;
        }
        if (worker.start()) {
            log.info("[{}] Queueing publisher started", name);
        }
    }

    /**
     * Queue a message for publication.
     *
     * @return false if the queue is full or the publisher is shut down, true once queued
     */
    @Override
    public boolean publish(T message, String routingKey, String contentType, Map<String, Object> headers) {
        return enqueue(toItem(message, routingKey, contentType, headers));
    }

    @Override
    public CompletableFuture<Boolean> publishAsync(T message, String routingKey, String contentType,
                                                   Map<String, Object> headers) {
        return CompletableFuture.completedFuture(publish(message, routingKey, contentType, headers));
    }

    public boolean enqueue(QueueItem<T> item) {
        int maxQueueDepth = settings.maxQueueDepth();
        synchronized (enqueueLock) {
            if (shutdownRequested) {
                log.warn("[{}] Publisher is shut down, message [{}] discarded", name, item.routingKey());
                return false;
            }
            if (maxQueueDepth >= 0 && depth.get() >= maxQueueDepth) {
                log.warn("[{}] Queue depth limit {} reached, message [{}] discarded",
                        name, maxQueueDepth, item.routingKey());
                return false;
            }
            queue.offer(item);
            depth.incrementAndGet();
        }
        itemsAvailable.release();
        log.trace("[{}] Queued [{}], depth {}", name, item.routingKey(), depth.get());
        return true;
    }

    /**
     * Send immediately on the caller's thread, skipping the queue. Meant for
     * request/response style sends; ordering relative to queued items is not guaranteed.
     */
    public boolean forcePublish(T message, String routingKey, String contentType, Map<String, Object> headers) {
        return sender.publish(message, routingKey, contentType, headers);
    }

    public boolean forcePublish(T message) {
        return forcePublish(message, null, null, null);
    }

    @Override
    public void setAsyncExecutor(Executor executor) {
        super.setAsyncExecutor(executor);
        sender.setAsyncExecutor(executor);
    }

    public CompletableFuture<Boolean> forcePublishAsync(T message, String routingKey, String contentType,
                                                        Map<String, Object> headers) {
        return sender.publishAsync(message, routingKey, contentType, headers);
    }

    /**
     * Stop accepting items, drain what is queued and stop the worker. A later
     * {@link #start()} accepts items again.
     *
     * @return false if the worker had to be forced or items are left unpublished
     */
    @Override
    public boolean shutdown(Duration timeout) {
        synchronized (enqueueLock) {
            shutdownRequested = true;
        }
        if (worker.state() == WorkerState.STOPPED) {
            int left = depth.get();
            if (left > 0) {
                log.warn("[{}] Shut down without a running worker, {} message(s) not published", name, left);
            }
            return !worker.isForcedStop() && left == 0;
        }
        log.info("[{}] Queueing publisher shutting down ({} queued)", name, depth.get());
        boolean clean = worker.shutdown(timeout);
        if (!clean) {
            log.warn("[{}] Timed out shutting down, possible loss of {} message(s)", name, depth.get());
        }
        return clean && depth.get() == 0;
    }

    @Override
    public void close() {
        shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
        sender.close();
        async.close();
    }

    @Override
    public boolean isActive() {
        return sender.isActive();
    }

    public int queueDepth() {
        return depth.get();
    }

    public WorkerState state() {
        return worker.state();
    }

    public boolean isForcedStop() {
        return worker.isForcedStop();
    }

    private void drain(CancellationToken stopRequested, CancellationToken forcedStop) {
        log.debug("[{}] Queue worker running", name);
        while (!(stopRequested.isCancelled() && queue.isEmpty())) {
            if (forcedStop.isCancelled()) {
                break;
            }
            try {
                if (!itemsAvailable.tryAcquire(POLL_INTERVAL.toMillis(), TimeUnit.MILLISECONDS)) {
                    continue;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            QueueItem<T> item = queue.poll();
            if (item == null) {
                continue;
            }
            depth.decrementAndGet();
            publishUntilSent(item, forcedStop);
        }
        if (!queue.isEmpty()) {
            log.warn("[{}] Queue worker stopped with {} unpublished message(s)", name, depth.get());
        } else {
            log.info("[{}] Queue worker stopped", name);
        }
    }

    private void publishUntilSent(QueueItem<T> item, CancellationToken forcedStop) {
        while (true) {
            boolean sent;
            try {
                sent = sender.send(item, forcedStop);
            } catch (MessageSerializationException e) {
                log.error("[{}] Dropping message [{}]: {}", name, item.routingKey(), e.getMessage(), e);
                return;
            } catch (RuntimeException e) {
                log.warn("[{}] Error publishing [{}]: {}", name, item.routingKey(), e.getMessage(), e);
                sent = false;
            }
            if (sent) {
                return;
            }
            try {
                if (forcedStop.await(retryDelay)) {
                    log.warn("[{}] Forced stop, message [{}] was not published", name, item.routingKey());
                    return;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("[{}] Interrupted, message [{}] was not published", name, item.routingKey());
                return;
            }
        }
    }
}
