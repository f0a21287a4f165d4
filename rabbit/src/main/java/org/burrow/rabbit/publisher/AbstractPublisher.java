package org.burrow.rabbit.publisher;

import org.burrow.rabbit.config.PublisherSettings;
import org.burrow.rabbit.lifecycle.AsyncRunner;
import org.burrow.rabbit.routing.RoutingKeyGenerator;
import org.burrow.rabbit.routing.RoutingKeys;
import org.burrow.rabbit.serialization.JsonCodec;
import org.burrow.rabbit.serialization.MessageSerializer;

import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Resolves defaults (routing key, content type) and derives the convenience overloads
 * of {@link RabbitPublisher} from the single {@link #publish(Object, String, String, Map)}.
 */
public abstract class AbstractPublisher<T> implements RabbitPublisher<T> {

    protected final String name;
    protected final PublisherSettings settings;
    protected final MessageSerializer<T> serializer;
    protected final RoutingKeyGenerator<T> routingKeyGenerator;
    protected final AsyncRunner async;

    protected AbstractPublisher(String name, PublisherSettings settings,
                                MessageSerializer<T> serializer, RoutingKeyGenerator<T> routingKeyGenerator) {
        this.name = name;
        this.settings = settings;
        this.serializer = serializer == null ? JsonCodec.serializer() : serializer;
        this.routingKeyGenerator = routingKeyGenerator == null ? RoutingKeys.wildcard() : routingKeyGenerator;
        this.async = new AsyncRunner("burrow-async-" + name);
    }

    @Override
    public String getName() {
        return name;
    }

    public PublisherSettings getSettings() {
        return settings;
    }

    /**
     * Run {@code publishAsync} on {@code executor} instead of this publisher's own thread.
     */
    public void setAsyncExecutor(Executor executor) {
        async.setExecutor(executor);
    }

    @Override
    public boolean publish(T message) {
        return publish(message, null, null, null);
    }

    @Override
    public boolean publish(T message, Map<String, Object> headers) {
        return publish(message, null, null, headers);
    }

    @Override
    public CompletableFuture<Boolean> publishAsync(T message) {
        return publishAsync(message, null, null, null);
    }

    @Override
    public CompletableFuture<Boolean> publishAsync(T message, Map<String, Object> headers) {
        return publishAsync(message, null, null, headers);
    }

    @Override
    public CompletableFuture<Boolean> publishAsync(T message, String routingKey, String contentType,
                                                   Map<String, Object> headers) {
        return async.supply(() -> publish(message, routingKey, contentType, headers), false);
    }

    protected QueueItem<T> toItem(T message, String routingKey, String contentType, Map<String, Object> headers) {
        return new QueueItem<>(message,
                routingKey != null ? routingKey : routingKeyGenerator.routingKey(message),
                contentType != null ? contentType : settings.contentType(),
                headers);
    }

    @Override
    public void start() {
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + " -> " + settings.exchange() + "]";
    }
}
