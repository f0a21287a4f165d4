package org.burrow.rabbit.consumer;

import org.burrow.rabbit.config.ConsumerSettings;

import java.io.Closeable;
import java.time.Duration;

/**
 * Receives payloads of type {@code T} from one queue.
 */
public interface RabbitConsumer<T> extends Closeable {

    String getName();

    ConsumerSettings getSettings();

    /**
     * @return true if the broker connection and channel are currently open
     */
    boolean isActive();

    void start();

    /**
     * Stop consuming, waiting at most {@code timeout} plus a short grace period. Idempotent.
     *
     * @return true if the consumer stopped without being forced
     */
    boolean shutdown(Duration timeout);

    @Override
    void close();
}
