package org.burrow.rabbit.publisher;

import org.burrow.rabbit.config.PublisherSettings;
import org.burrow.rabbit.routing.RoutingKeyGenerator;
import org.burrow.rabbit.serialization.MessageSerializationException;
import org.burrow.rabbit.serialization.MessageSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Publisher that never touches a broker. Messages are serialized and logged, and every
 * publish succeeds. Useful for local runs and for wiring tests.
 */
public class SimulatedPublisher<T> extends AbstractPublisher<T> {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPublisher.class);

    private final AtomicLong published = new AtomicLong();

    public SimulatedPublisher(String name, PublisherSettings settings) {
        this(name, settings, null, null);
    }

    public SimulatedPublisher(String name, PublisherSettings settings,
                              MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator) {
        super(name, settings, serializer, routingKeyGenerator);
    }

    @Override
    public boolean publish(T message, String routingKey, String contentType, Map<String, Object> headers) {
        QueueItem<T> item = toItem(message, routingKey, contentType, headers);
        byte[] body;
        try {
            body = serializer.serialize(item.payload());
        } catch (MessageSerializationException e) {
            log.error("[{}] {}", name, e.getMessage(), e);
            return false;
        }
        log.info("[{}] Simulated publication [{}] to {}: {} bytes, contentType={}, encoding={}, headers={}",
                name, item.routingKey(), settings.exchange(), body.length,
                item.contentType(), item.contentEncoding(), item.headers() == null ? "{}" : item.headers());
        published.incrementAndGet();
        return true;
    }

    public long publishedCount() {
        return published.get();
    }

    @Override
    public boolean isActive() {
        return true;
    }

    @Override
    public boolean shutdown(Duration timeout) {
        return true;
    }

    @Override
    public void close() {
        async.close();
    }
}
