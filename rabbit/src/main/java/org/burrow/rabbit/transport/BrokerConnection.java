package org.burrow.rabbit.transport;

import com.rabbitmq.client.Channel;

import java.io.Closeable;
import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * One logical connection plus its single channel, owned by exactly one publisher or consumer.
 *
 * <p>Implementations are not shared between instances, so they only need to be safe for
 * the owning instance's own threads.</p>
 *
 * <h3>Lifecycle:</h3>
 * <ol>
 *   <li>{@link #open()} - (re)open connection and channel, discarding any previous pair</li>
 *   <li>{@link #channel()} - use the channel while {@link #isOpen()} holds</li>
 *   <li>{@link #close()} - release both, never throws</li>
 * </ol>
 */
public interface BrokerConnection extends Closeable {

    /**
     * Open a new connection and channel. Any previous pair is closed first.
     *
     * @throws IOException      if the broker refuses or cannot be reached
     * @throws TimeoutException if the handshake times out
     */
    void open() throws IOException, TimeoutException;

    /**
     * @return true only if both the connection and the channel are open
     */
    boolean isOpen();

    /**
     * @return the current channel, or null if never opened
     */
    Channel channel();

    /**
     * @return broker identity for log messages (no credentials)
     */
    String describe();

    /**
     * Close channel and connection, swallowing failures. Idempotent.
     */
    @Override
    void close();
}
