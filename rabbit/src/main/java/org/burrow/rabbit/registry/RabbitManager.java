package org.burrow.rabbit.registry;

import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.config.PublisherSettings;
import org.burrow.rabbit.config.RabbitConfig;
import org.burrow.rabbit.config.RabbitConfigLoader;
import org.burrow.rabbit.consumer.ContinuousConsumer;
import org.burrow.rabbit.consumer.MessageCallback;
import org.burrow.rabbit.consumer.RabbitConsumer;
import org.burrow.rabbit.consumer.SimulatedConsumer;
import org.burrow.rabbit.consumer.SingleFetchConsumer;
import org.burrow.rabbit.lifecycle.ConnectionLifecycleProfile;
import org.burrow.rabbit.publisher.DirectPublisher;
import org.burrow.rabbit.publisher.QueueingPublisher;
import org.burrow.rabbit.publisher.RabbitPublisher;
import org.burrow.rabbit.publisher.SimulatedPublisher;
import org.burrow.rabbit.routing.RoutingKeyGenerator;
import org.burrow.rabbit.routing.RoutingKeys;
import org.burrow.rabbit.serialization.JsonCodec;
import org.burrow.rabbit.serialization.MessageDeserializer;
import org.burrow.rabbit.serialization.MessageSerializationException;
import org.burrow.rabbit.serialization.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * Builds publishers and consumers from a {@link RabbitConfig} and keeps them in a
 * {@link RabbitRegistry}.
 *
 * <h3>Usage with YAML config:</h3>
 * <pre>
 * var manager = RabbitManager.fromYaml(Path.of("burrow.yml"));
 * RabbitPublisher&lt;Order&gt; orders = manager.publisher("orders", Order.class);
 * manager.consumer("orders", Order.class, order -&gt; handle(order));
 * manager.start();
 * // ...
 * manager.close();
 * </pre>
 *
 * <p>Instances created while the manager is running are started right away.</p>
 */
public class RabbitManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RabbitManager.class);

    /** Body the simulated consumer deserializes to make each payload. */
    private static final byte[] EMPTY_OBJECT = "{}".getBytes(StandardCharsets.UTF_8);

    private final RabbitConfig config;
    private final RabbitRegistry registry;

    private volatile boolean running = false;

    // ========== Factory methods ==========

    public static RabbitManager fromYaml(Path path) {
        try {
            return new RabbitManager(RabbitConfigLoader.fromYaml(path));
        } catch (Exception e) {
            throw new RuntimeException("Failed to load config from " + path, e);
        }
    }

    public static RabbitManager fromClasspath(String resource) {
        return new RabbitManager(RabbitConfigLoader.fromClasspath(resource));
    }

    // ========== Constructor ==========

    public RabbitManager(RabbitConfig config) {
        this(config, new RabbitRegistry());
    }

    public RabbitManager(RabbitConfig config, RabbitRegistry registry) {
        this.config = config;
        this.registry = registry;
    }

    // ========== Publishers ==========

    /**
     * Publisher configured under {@code name}, JSON-serialized, routed with {@code #}.
     */
    public <T> RabbitPublisher<T> publisher(String name, Class<T> payloadType) {
        return publisher(name, JsonCodec.serializer(), RoutingKeys.wildcard());
    }

    public <T> RabbitPublisher<T> publisher(String name, MessageSerializer<T> serializer,
                                            RoutingKeyGenerator<T> routingKeyGenerator) {
        RabbitPublisher<T> publisher = registry.registerPublisher(name,
                () -> createPublisher(name, serializer, routingKeyGenerator));
        if (running) {
            publisher.start();
        }
        return publisher;
    }

    // ========== Consumers ==========

    /**
     * Consumer configured under {@code name}, JSON-deserialized into {@code payloadType}.
     */
    public <T> RabbitConsumer<T> consumer(String name, Class<T> payloadType, MessageCallback<T> callback) {
        return consumer(name, JsonCodec.deserializer(payloadType), callback);
    }

    public <T> RabbitConsumer<T> consumer(String name, MessageDeserializer<T> deserializer,
                                          MessageCallback<T> callback) {
        RabbitConsumer<T> consumer = registry.registerConsumer(name,
                () -> createConsumer(name, deserializer, callback));
        if (running) {
            consumer.start();
        }
        return consumer;
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running) {
            log.warn("RabbitManager is already running");
            return;
        }
        log.info("Starting {} publisher(s) and {} consumer(s)",
                registry.publisherNames().size(), registry.consumerNames().size());
        registry.startAll();
        running = true;
    }

    /**
     * Shut down every registered instance but keep the registrations, so a later
     * {@link #start()} brings them back.
     */
    public synchronized void stop() {
        if (!running) return;
        running = false;
        registry.stopAll();
        log.info("All publishers and consumers stopped");
    }

    /**
     * Stop, then close and forget every registered instance.
     */
    @Override
    public synchronized void close() {
        running = false;
        registry.close();
    }

    public boolean isRunning() {
        return running;
    }

    public RabbitConfig getConfig() {
        return config;
    }

    public RabbitRegistry getRegistry() {
        return registry;
    }

    // ========== Internal ==========

    private <T> RabbitPublisher<T> createPublisher(String name, MessageSerializer<T> serializer,
                                                   RoutingKeyGenerator<T> routingKeyGenerator) {
        RabbitConfig.PublisherConfig pub = config.getPublishers().get(name);
        if (pub == null) {
            throw new IllegalArgumentException("No publisher configured under name: " + name);
        }
        PublisherSettings settings = config.toPublisherSettings(name);
        ConnectionLifecycleProfile profile = config.toLifecycleProfile();
        log.info("Creating {} publisher {} for exchange {}", pub.getType(), name, settings.exchange());
        return switch (pub.getType()) {
            case direct -> new DirectPublisher<>(name, settings, profile, serializer, routingKeyGenerator);
            case queueing -> new QueueingPublisher<>(name, settings, profile, serializer, routingKeyGenerator);
            case simulated -> new SimulatedPublisher<>(name, settings, serializer, routingKeyGenerator);
        };
    }

    private <T> RabbitConsumer<T> createConsumer(String name, MessageDeserializer<T> deserializer,
                                                 MessageCallback<T> callback) {
        RabbitConfig.ConsumerConfig con = config.getConsumers().get(name);
        if (con == null) {
            throw new IllegalArgumentException("No consumer configured under name: " + name);
        }
        ConsumerSettings settings = config.toConsumerSettings(name);
        ConnectionLifecycleProfile profile = config.toLifecycleProfile();
        log.info("Creating {} consumer {} for queue {}", con.getType(), name, settings.queue());
        return switch (con.getType()) {
            case continuous -> new ContinuousConsumer<>(name, settings, profile, deserializer, callback);
            case single_fetch -> new SingleFetchConsumer<>(name, settings, profile, deserializer, callback);
            case simulated -> new SimulatedConsumer<>(name, settings, emptyPayloads(name, deserializer), callback);
        };
    }

    private static <T> Supplier<T> emptyPayloads(String name, MessageDeserializer<T> deserializer) {
        return () -> {
            try {
                return deserializer.deserialize(EMPTY_OBJECT);
            } catch (Exception e) {
                throw new MessageSerializationException("Cannot make a simulated payload for consumer " + name, e);
            }
        };
    }
}
