package org.burrow.rabbit.consumer;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.DefaultConsumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.lifecycle.BackgroundWorker;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.lifecycle.WorkerState;
import org.burrow.rabbit.serialization.JsonCodec;
import org.burrow.rabbit.serialization.MessageDeserializer;
import org.burrow.rabbit.topology.TopologyReconciler;
import org.burrow.rabbit.transport.AmqpBrokerConnection;
import org.burrow.rabbit.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;

/**
 * Consumes a queue on a dedicated worker thread until shut down.
 *
 * <p>The worker connects, subscribes, then checks every 250 ms that the connection and
 * channel are still open. When they are not (or the broker cancelled the subscription)
 * it reconnects and subscribes again. Errors never end the loop; only
 * {@link #shutdown(Duration)} does.</p>
 */
public class ContinuousConsumer<T> extends AbstractConsumer<T> {

    private static final Logger log = LoggerFactory.getLogger(ContinuousConsumer.class);

    public static final Duration LIVENESS_POLL_INTERVAL = Duration.ofMillis(250);
    public static final Duration ERROR_PAUSE = Duration.ofSeconds(1);

    private final BackgroundWorker worker;
    private final Duration errorPause;

    private volatile boolean cancelledByBroker;

    public ContinuousConsumer(String name, ConsumerSettings settings, Class<T> type, MessageCallback<T> callback) {
        this(name, settings, ConnectionLifecycleProfile.defaults(), JsonCodec.deserializer(type), callback);
    }

    public ContinuousConsumer(String name, ConsumerSettings settings, ConnectionLifecycleProfile profile,
                              MessageDeserializer<T> deserializer, MessageCallback<T> callback) {
        this(name, settings, profile, deserializer, callback, new AmqpBrokerConnection(settings.endpoint()),
                ERROR_PAUSE, BackgroundWorker.FORCED_STOP_GRACE);
    }

    public ContinuousConsumer(String name, ConsumerSettings settings, ConnectionLifecycleProfile profile,
                              MessageDeserializer<T> deserializer, MessageCallback<T> callback,
                              BrokerConnection connection, Duration errorPause, Duration forcedStopGrace) {
        super(name, settings, profile, deserializer, callback, connection, new TopologyReconciler());
        this.errorPause = errorPause;
        this.worker = new BackgroundWorker("burrow-consumer-" + name, this::run, forcedStopGrace);
    }

    @Override
    public void start() {
        if (worker.start()) {
            log.info("[{}] Consumer starting on queue {}", name, settings.queue());
        }
    }

    @Override
    public boolean shutdown(Duration timeout) {
        if (worker.state() == WorkerState.STOPPED) {
            return !worker.isForcedStop();
        }
        log.info("[{}] Consumer shutting down", name);
        boolean clean = worker.shutdown(timeout);
        if (!clean) {
            log.warn("[{}] Timed out shutting down consumer", name);
        }
        return clean;
    }

    @Override
    public void close() {
        shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
        lifecycle.close();
    }

    public WorkerState state() {
        return worker.state();
    }

    public boolean isForcedStop() {
        return worker.isForcedStop();
    }

    private void run(CancellationToken stopRequested, CancellationToken forcedStop) {
        try {
            while (!stopRequested.isCancelled()) {
                try {
                    if (!lifecycle.ensureConnected(stopRequested)) {
                        log.warn("[{}] Connection to {} is not active", name, lifecycle.connection().describe());
                        if (stopRequested.await(errorPause)) break;
                        continue;
                    }
                    Channel channel = lifecycle.connection().channel();
                    String consumerTag = subscribe(channel);
                    awaitInterruption(stopRequested, forcedStop);
                    cancelQuietly(channel, consumerTag);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    break;
                } catch (Exception e) {
                    log.error("[{}] Consumer error: {}", name, e.getMessage(), e);
                    try {
                        if (stopRequested.await(errorPause)) break;
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        break;
                    }
                }
            }
        } finally {
            lifecycle.disconnect();
            log.info("[{}] Consumer stopped", name);
        }
    }

    private String subscribe(Channel channel) throws IOException {
        cancelledByBroker = false;
        String consumerTag = channel.basicConsume(settings.queue(), settings.autoAck(), new DefaultConsumer(channel) {
            @Override
            public void handleDelivery(String tag, Envelope envelope,
                                       AMQP.BasicProperties properties, byte[] body) {
                handler.handle(getChannel(), envelope.getDeliveryTag(), body);
            }

            @Override
            public void handleCancel(String tag) {
                log.warn("[{}] Subscription to {} was cancelled by the broker", name, settings.queue());
                cancelledByBroker = true;
            }

            @Override
            public void handleShutdownSignal(String tag, ShutdownSignalException sig) {
                log.warn("[{}] Channel is shutting down: {}", name, sig.getMessage());
            }
        });
        log.info("[{}] Consuming from {} (autoAck={}, prefetch={})",
                name, settings.queue(), settings.autoAck(), settings.prefetchCount());
        return consumerTag;
    }

    /**
     * Block until a stop is requested or the subscription stops being usable.
     */
    private void awaitInterruption(CancellationToken stopRequested, CancellationToken forcedStop)
            throws InterruptedException {
        while (!stopRequested.isCancelled()) {
            if (forcedStop.isCancelled()) {
                return;
            }
            if (!lifecycle.isActive()) {
                log.warn("[{}] Connection to {} lost, reconnecting", name, lifecycle.connection().describe());
                return;
            }
            if (cancelledByBroker) {
                return;
            }
            stopRequested.await(LIVENESS_POLL_INTERVAL);
        }
    }

    private void cancelQuietly(Channel channel, String consumerTag) {
        try { if (channel != null && channel.isOpen() && consumerTag != null) channel.basicCancel(consumerTag); }
        catch (Exception e) { log.debug("[{}] Error cancelling consumer: {}", name, e.getMessage()); }
    }
}
