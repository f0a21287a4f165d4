package org.burrow.rabbit.consumer;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.GetResponse;
import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.lifecycle.AsyncRunner;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.serialization.JsonCodec;
import org.burrow.rabbit.serialization.MessageDeserializer;
import org.burrow.rabbit.topology.TopologyReconciler;
import org.burrow.rabbit.transport.AmqpBrokerConnection;
import org.burrow.rabbit.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Pulls one message per call with {@code basic.get}, for polling and request/response use.
 * Runs on the caller's thread; there is no background worker.
 */
public class SingleFetchConsumer<T> extends AbstractConsumer<T> {

    private static final Logger log = LoggerFactory.getLogger(SingleFetchConsumer.class);

    private volatile CancellationToken closing = new CancellationToken();
    private final AsyncRunner async;

    public SingleFetchConsumer(String name, ConsumerSettings settings, Class<T> type, MessageCallback<T> callback) {
        this(name, settings, ConnectionLifecycleProfile.defaults(), JsonCodec.deserializer(type), callback);
    }

    public SingleFetchConsumer(String name, ConsumerSettings settings, ConnectionLifecycleProfile profile,
                               MessageDeserializer<T> deserializer, MessageCallback<T> callback) {
        this(name, settings, profile, deserializer, callback, new AmqpBrokerConnection(settings.endpoint()));
    }

    public SingleFetchConsumer(String name, ConsumerSettings settings, ConnectionLifecycleProfile profile,
                               MessageDeserializer<T> deserializer, MessageCallback<T> callback,
                               BrokerConnection connection) {
        super(name, settings, profile, deserializer, callback, connection, new TopologyReconciler());
        this.async = new AsyncRunner("burrow-fetch-" + name);
    }

    /**
     * Fetch and handle at most one message.
     *
     * @return true if a message was fetched, processed and settled successfully
     */
    public boolean fetchMessage(CancellationToken cancellation) {
        return fetch(cancellation).map(AckOutcome::isSuccess).orElse(false);
    }

    public boolean fetchMessage() {
        return fetchMessage(closing);
    }

    public CompletableFuture<Boolean> fetchMessageAsync(CancellationToken cancellation) {
        return async.supply(() -> fetchMessage(cancellation), false);
    }

    /**
     * Run {@code fetchMessageAsync} on {@code executor} instead of this consumer's own thread.
     */
    public void setAsyncExecutor(Executor executor) {
        async.setExecutor(executor);
    }

    /**
     * @return the outcome for the fetched message, or empty if nothing was fetched
     */
    public synchronized Optional<AckOutcome> fetch(CancellationToken cancellation) {
        if (!lifecycle.ensureConnected(cancellation)) {
            log.warn("[{}] Connection to {} is not active", name, lifecycle.connection().describe());
            return Optional.empty();
        }
        Channel channel = lifecycle.connection().channel();
        try {
            GetResponse response = channel.basicGet(settings.queue(), settings.autoAck());
            if (response == null) {
                log.debug("[{}] No message waiting on {}", name, settings.queue());
                return Optional.empty();
            }
            return Optional.of(handler.handle(channel, response.getEnvelope().getDeliveryTag(), response.getBody()));
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Fetching from {} failed: {}", name, settings.queue(), e.getMessage(), e);
            return Optional.empty();
        }
    }

    @Override
    public void start() {
    }

    /**
     * Abort any reconnect wait in progress and drop the connection. The next fetch
     * reconnects; only {@link #close()} is final.
     */
    @Override
    public boolean shutdown(Duration timeout) {
        CancellationToken current = closing;
        closing = new CancellationToken();
        current.cancel();
        lifecycle.disconnect();
        return true;
    }

    @Override
    public void close() {
        closing.cancel();
        lifecycle.close();
        async.close();
    }
}
