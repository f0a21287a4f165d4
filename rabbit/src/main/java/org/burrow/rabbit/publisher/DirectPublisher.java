package org.burrow.rabbit.publisher;

import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import org.burrow.rabbit.config.PublisherSettings;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleManager;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.routing.RoutingKeyGenerator;
import org.burrow.rabbit.serialization.MessageSerializationException;
import org.burrow.rabbit.serialization.MessageSerializer;
import org.burrow.rabbit.topology.TopologyReconciler;
import org.burrow.rabbit.transport.AmqpBrokerConnection;
import org.burrow.rabbit.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Publishes on the caller's thread.
 *
 * <p>Each publish first makes sure the connection is up (per the lifecycle profile), then
 * sends. With acks enabled the channel is in confirm mode and the call blocks until the
 * broker confirms; a nack or a confirm timeout makes the publish return false. Failed
 * publishes are not retried here.</p>
 */
public class DirectPublisher<T> extends AbstractPublisher<T> {

    private static final Logger log = LoggerFactory.getLogger(DirectPublisher.class);

    private final ConnectionLifecycleManager lifecycle;
    private final TopologyReconciler topology = new TopologyReconciler();
    private volatile CancellationToken closing = new CancellationToken();

    public DirectPublisher(String name, PublisherSettings settings) {
        this(name, settings, ConnectionLifecycleProfile.defaults(), null, null);
    }

    public DirectPublisher(String name, PublisherSettings settings, ConnectionLifecycleProfile profile,
                           MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator) {
        this(name, settings, profile, serializer, routingKeyGenerator,
                new AmqpBrokerConnection(settings.endpoint()));
    }

    public DirectPublisher(String name, PublisherSettings settings, ConnectionLifecycleProfile profile,
                           MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator,
                           BrokerConnection connection) {
        super(name, settings, serializer, routingKeyGenerator);
        this.lifecycle = new ConnectionLifecycleManager(name, connection, profile, this::configureChannel);
    }

    @Override
    public boolean publish(T message, String routingKey, String contentType, Map<String, Object> headers) {
        try {
            return send(toItem(message, routingKey, contentType, headers), closing);
        } catch (MessageSerializationException e) {
            log.error("[{}] {}", name, e.getMessage(), e);
            return false;
        }
    }

    /**
     * Connect if needed and send one item.
     *
     * @param cancellation aborts reconnect waits
     * @throws MessageSerializationException if the payload cannot be serialized
     */
    synchronized boolean send(QueueItem<T> item, CancellationToken cancellation) {
        byte[] body = serializer.serialize(item.payload());

        if (!lifecycle.ensureConnected(cancellation)) {
            log.warn("[{}] Connection to {} is not active, message [{}] not published",
                    name, lifecycle.connection().describe(), item.routingKey());
            return false;
        }

        Channel channel = lifecycle.connection().channel();
        AMQP.BasicProperties properties = new AMQP.BasicProperties.Builder()
                .contentType(item.contentType())
                .contentEncoding(item.contentEncoding())
                .headers(item.headers())
                .build();
        try {
            channel.basicPublish(settings.exchange(), item.routingKey(), properties, body);
            if (settings.enableAcks() && !channel.waitForConfirms(settings.confirmTimeout().toMillis())) {
                log.warn("[{}] Broker nacked message [{}] on {}", name, item.routingKey(), settings.exchange());
                return false;
            }
            log.debug("[{}] Published [{}] to {} ({} bytes)", name, item.routingKey(), settings.exchange(), body.length);
            return true;
        } catch (TimeoutException e) {
            log.warn("[{}] Message [{}] not confirmed within {} ms", name, item.routingKey(),
                    settings.confirmTimeout().toMillis());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Publishing [{}] to {} failed: {}", name, item.routingKey(), settings.exchange(),
                    e.getMessage(), e);
            return false;
        }
    }

    @Override
    public boolean isActive() {
        return lifecycle.isActive();
    }

    /**
     * Abort any reconnect wait in progress and drop the connection. The next publish
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

    ConnectionLifecycleManager lifecycle() {
        return lifecycle;
    }

    private void configureChannel(Channel channel, CancellationToken cancellation) throws IOException {
        if (settings.exchangeDeclaration() != null) {
            topology.declareExchange(channel, settings.exchange(), settings.exchangeDeclaration());
        }
        if (settings.enableAcks()) {
            channel.confirmSelect();
        }
    }
}
