package org.burrow.rabbit.consumer;

import com.rabbitmq.client.Channel;
import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleManager;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.serialization.MessageDeserializer;
import org.burrow.rabbit.topology.ManagementClient;
import org.burrow.rabbit.topology.TopologyReconciler;
import org.burrow.rabbit.transport.BrokerConnection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Connection handling shared by the consumers.
 *
 * <p>After every (re)connect the channel gets its prefetch, the configured exchange and
 * queue are declared, the queue is bound once per routing key and, when a management URI
 * is configured, bindings that are no longer wanted are removed.</p>
 */
public abstract class AbstractConsumer<T> implements RabbitConsumer<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractConsumer.class);

    protected final String name;
    protected final ConsumerSettings settings;
    protected final ConnectionLifecycleManager lifecycle;
    protected final DeliveryHandler<T> handler;

    private final TopologyReconciler topology;
    private final ManagementClient managementClient;

    protected AbstractConsumer(String name, ConsumerSettings settings, ConnectionLifecycleProfile profile,
                               MessageDeserializer<T> deserializer, MessageCallback<T> callback,
                               BrokerConnection connection, TopologyReconciler topology) {
        this.name = name;
        this.settings = settings;
        this.topology = topology;
        this.managementClient = settings.managementUri() == null ? null : new ManagementClient(settings.managementUri());
        this.handler = new DeliveryHandler<>(name, deserializer, callback,
                settings.autoAck(), settings.nackOnFalse(), settings.requeueOnNack());
        this.lifecycle = new ConnectionLifecycleManager(name, connection, profile, this::configureChannel);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ConsumerSettings getSettings() {
        return settings;
    }

    @Override
    public boolean isActive() {
        return lifecycle.isActive();
    }

    ConnectionLifecycleManager lifecycle() {
        return lifecycle;
    }

    private void configureChannel(Channel channel, CancellationToken cancellation) throws IOException {
        channel.basicQos(settings.prefetchCount());

        String exchange = settings.exchange();
        boolean hasExchange = exchange != null && !exchange.isEmpty();
        if (hasExchange && settings.exchangeDeclaration() != null) {
            topology.declareExchange(channel, exchange, settings.exchangeDeclaration());
        }
        if (settings.queueDeclaration() != null) {
            topology.declareQueue(channel, settings.queue(), settings.queueDeclaration());
        }
        if (hasExchange) {
            topology.bind(channel, settings.queue(), exchange, settings.routingKeys());
        }

        if (managementClient != null) {
            try {
                topology.reconcileBindings(managementClient, settings.endpoint().virtualHost(),
                        settings.queue(), settings.routingKeys(), cancellation);
            } catch (RuntimeException e) {
                log.warn("[{}] Failed to remove unexpected bindings of {}: {}", name, settings.queue(), e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " <- " + settings.queue() + "]";
    }
}
