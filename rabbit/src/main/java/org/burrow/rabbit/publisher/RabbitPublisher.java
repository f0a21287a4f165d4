package org.burrow.rabbit.publisher;

import java.io.Closeable;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Publishes payloads of type {@code T} to one exchange.
 *
 * <p>Publish methods never throw for broker trouble; they return false instead. What
 * {@code true} means depends on the implementation: {@link DirectPublisher} returns it once
 * the message was sent (and confirmed, with acks enabled), {@link QueueingPublisher} once
 * the message was accepted into its queue.</p>
 *
 * <h3>Lifecycle:</h3>
 * <ol>
 *   <li>{@link #start()} - start background work, if the implementation has any</li>
 *   <li>{@code publish(...)} / {@code publishAsync(...)}</li>
 *   <li>{@link #shutdown(Duration)} - drain and stop, bounded by the timeout</li>
 *   <li>{@link #close()} - shutdown with the default timeout and release the connection</li>
 * </ol>
 */
public interface RabbitPublisher<T> extends Closeable {

    String getName();

    /**
     * Publish with the generated routing key and the configured content type.
     */
    boolean publish(T message);

    boolean publish(T message, Map<String, Object> headers);

    /**
     * @param routingKey  routing key, or null to use the generator
     * @param contentType content type, or null to use the configured one
     * @param headers     AMQP headers, may be null
     */
    boolean publish(T message, String routingKey, String contentType, Map<String, Object> headers);

    CompletableFuture<Boolean> publishAsync(T message);

    CompletableFuture<Boolean> publishAsync(T message, Map<String, Object> headers);

    CompletableFuture<Boolean> publishAsync(T message, String routingKey, String contentType,
                                            Map<String, Object> headers);

    /**
     * @return true if the broker connection and channel are currently open
     */
    boolean isActive();

    void start();

    /**
     * Stop background work, waiting at most {@code timeout} plus a short grace period.
     * Idempotent.
     *
     * @return true if everything pending was handled before stopping
     */
    boolean shutdown(Duration timeout);

    @Override
    void close();
}
