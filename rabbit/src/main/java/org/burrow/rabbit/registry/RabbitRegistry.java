package org.burrow.rabbit.registry;

import org.burrow.rabbit.consumer.RabbitConsumer;
import org.burrow.rabbit.lifecycle.BackgroundWorker;
import org.burrow.rabbit.publisher.RabbitPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Named publishers and consumers.
 *
 * <p>An ordinary object: create one per application (or per test) and pass it around.
 * Registration is create-if-absent, and lookups of unknown names fail immediately with
 * {@link IllegalArgumentException}.</p>
 */
public class RabbitRegistry implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(RabbitRegistry.class);

    /** name → publisher */
    private final Map<String, RabbitPublisher<?>> publishers = new ConcurrentHashMap<>();

    /** name → consumer */
    private final Map<String, RabbitConsumer<?>> consumers = new ConcurrentHashMap<>();

    /**
     * Key used when no explicit name is given: the payload type's simple name.
     */
    public static String defaultName(Class<?> payloadType) {
        return payloadType.getSimpleName();
    }

    /**
     * Return the publisher registered under {@code name}, creating it with {@code factory}
     * if there is none yet.
     */
    @SuppressWarnings("unchecked")
    public <T> RabbitPublisher<T> registerPublisher(String name, Supplier<? extends RabbitPublisher<T>> factory) {
        return (RabbitPublisher<T>) publishers.computeIfAbsent(name, k -> {
            log.debug("Registering publisher {}", k);
            return factory.get();
        });
    }

    @SuppressWarnings("unchecked")
    public <T> RabbitConsumer<T> registerConsumer(String name, Supplier<? extends RabbitConsumer<T>> factory) {
        return (RabbitConsumer<T>) consumers.computeIfAbsent(name, k -> {
            log.debug("Registering consumer {}", k);
            return factory.get();
        });
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under {@code name}
     */
    @SuppressWarnings("unchecked")
    public <T> RabbitPublisher<T> publisher(String name) {
        RabbitPublisher<?> publisher = publishers.get(name);
        if (publisher == null) {
            throw new IllegalArgumentException("No publisher registered under name: " + name
                    + " (known: " + publisherNames() + ")");
        }
        return (RabbitPublisher<T>) publisher;
    }

    public <T> RabbitPublisher<T> publisher(Class<T> payloadType) {
        return publisher(defaultName(payloadType));
    }

    /**
     * @throws IllegalArgumentException if nothing is registered under {@code name}
     */
    @SuppressWarnings("unchecked")
    public <T> RabbitConsumer<T> consumer(String name) {
        RabbitConsumer<?> consumer = consumers.get(name);
        if (consumer == null) {
            throw new IllegalArgumentException("No consumer registered under name: " + name
                    + " (known: " + consumerNames() + ")");
        }
        return (RabbitConsumer<T>) consumer;
    }

    public <T> RabbitConsumer<T> consumer(Class<T> payloadType) {
        return consumer(defaultName(payloadType));
    }

    public boolean containsPublisher(String name) {
        return publishers.containsKey(name);
    }

    public boolean containsConsumer(String name) {
        return consumers.containsKey(name);
    }

    public Set<String> publisherNames() {
        return new TreeSet<>(publishers.keySet());
    }

    public Set<String> consumerNames() {
        return new TreeSet<>(consumers.keySet());
    }

    /**
     * Remove and close a publisher. Unknown names are ignored.
     */
    public void removePublisher(String name) {
        RabbitPublisher<?> publisher = publishers.remove(name);
        if (publisher != null) {
            publisher.close();
            log.info("Removed publisher {}", name);
        }
    }

    /**
     * Remove and close a consumer. Unknown names are ignored.
     */
    public void removeConsumer(String name) {
        RabbitConsumer<?> consumer = consumers.remove(name);
        if (consumer != null) {
            consumer.close();
            log.info("Removed consumer {}", name);
        }
    }

    public void startAll() {
        for (Map.Entry<String, RabbitConsumer<?>> entry : consumers.entrySet()) {
            try {
                entry.getValue().start();
            } catch (Exception e) {
                log.error("Failed to start consumer {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
        for (Map.Entry<String, RabbitPublisher<?>> entry : publishers.entrySet()) {
            try {
                entry.getValue().start();
            } catch (Exception e) {
                log.error("Failed to start publisher {}: {}", entry.getKey(), e.getMessage(), e);
            }
        }
    }

    /**
     * Shut down everything, consumers first, keeping the registrations.
     */
    public void stopAll() {
        for (Map.Entry<String, RabbitConsumer<?>> entry : consumers.entrySet()) {
            try {
                entry.getValue().shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
            } catch (Exception e) {
                log.warn("Error stopping consumer {}: {}", entry.getKey(), e.getMessage());
            }
        }
        for (Map.Entry<String, RabbitPublisher<?>> entry : publishers.entrySet()) {
            try {
                entry.getValue().shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
            } catch (Exception e) {
                log.warn("Error stopping publisher {}: {}", entry.getKey(), e.getMessage());
            }
        }
    }

    /**
     * Shut down and close everything, consumers first, then clear the registry.
     */
    @Override
    public void close() {
        for (Map.Entry<String, RabbitConsumer<?>> entry : consumers.entrySet()) {
            try {
                entry.getValue().shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
                entry.getValue().close();
            } catch (Exception e) {
                log.warn("Error stopping consumer {}: {}", entry.getKey(), e.getMessage());
            }
        }
        for (Map.Entry<String, RabbitPublisher<?>> entry : publishers.entrySet()) {
            try {
                entry.getValue().shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
                entry.getValue().close();
            } catch (Exception e) {
                log.warn("Error stopping publisher {}: {}", entry.getKey(), e.getMessage());
            }
        }
        consumers.clear();
        publishers.clear();
    }
}
