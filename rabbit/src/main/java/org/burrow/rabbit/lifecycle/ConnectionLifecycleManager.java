package org.burrow.rabbit.lifecycle;

import org.burrow.rabbit.transport.BrokerConnection;
import org.burrow.rabbit.transport.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Closeable;
import java.io.IOException;

/**
 * Applies a {@link ConnectionLifecycleProfile} to a {@link BrokerConnection}.
 *
 * <p>Each publisher and consumer owns one manager. {@link #ensureConnected(CancellationToken)}
 * is the only way their connection gets (re)opened: it returns immediately when the
 * connection and channel are both open, otherwise it keeps attempting according to the
 * profile and runs the owner's {@link ConnectionSetup} after every successful open.</p>
 *
 * <p>Ordinary connect failures are reported to the {@link ConnectionAttemptListener} and
 * never thrown. Only configuration errors ({@link TransportException},
 * {@link IllegalArgumentException}) escape.</p>
 */
public class ConnectionLifecycleManager implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(ConnectionLifecycleManager.class);

    private final String name;
    private final BrokerConnection connection;
    private final ConnectionLifecycleProfile profile;
    private final ConnectionSetup setup;
    private final ConnectionAttemptListener listener;

    private volatile LifecycleState state = LifecycleState.DISCONNECTED;

    public ConnectionLifecycleManager(String name, BrokerConnection connection,
                                      ConnectionLifecycleProfile profile, ConnectionSetup setup) {
        this(name, connection, profile, setup, ConnectionAttemptListener.LOGGING);
    }

    public ConnectionLifecycleManager(String name, BrokerConnection connection,
                                      ConnectionLifecycleProfile profile, ConnectionSetup setup,
                                      ConnectionAttemptListener listener) {
        this.name = name;
        this.connection = connection;
        this.profile = profile;
        this.setup = setup == null ? ConnectionSetup.NONE : setup;
        this.listener = listener == null ? ConnectionAttemptListener.LOGGING : listener;
    }

    /**
     * Make sure the connection is usable, reconnecting if needed.
     *
     * <p>Cancelling {@code cancellation} aborts the wait between attempts, not an attempt
     * already in flight.</p>
     *
     * @return true if connected, false if attempts were exhausted, the wait was cancelled
     *         or this manager is closed
     * @throws TransportException if the endpoint configuration is unusable
     */
    public synchronized boolean ensureConnected(CancellationToken cancellation) {
        if (state == LifecycleState.CLOSED) {
            log.debug("[{}] Connection manager is closed, not connecting", name);
            return false;
        }
        if (connection.isOpen()) {
            state = LifecycleState.CONNECTED;
            return true;
        }

        transition(LifecycleState.CONNECTING);
        int failures = 0;
        while (state != LifecycleState.CLOSED) {
            int attempt = failures + 1;
            try {
                connection.open();
                setup.configure(connection.channel(), cancellation);
                if (!connection.isOpen()) {
                    throw new IOException("Channel closed during connection setup");
                }
                transition(LifecycleState.CONNECTED);
                listener.onConnected(name, connection.describe(), attempt);
                return true;
            } catch (TransportException | IllegalArgumentException e) {
                connection.close();
                transition(LifecycleState.DISCONNECTED);
                throw e;
            } catch (Exception e) {
                failures++;
                connection.close();
                listener.onAttemptFailed(name, connection.describe(), attempt, e);
            }

            if (!profile.allowsAnotherAttempt(failures)) {
                log.warn("[{}] Giving up on {} after {} attempt(s)", name, connection.describe(), failures);
                break;
            }
            try {
                if (cancellation.await(profile.reconnectDelay())) {
                    log.debug("[{}] Reconnect wait cancelled", name);
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        transition(LifecycleState.DISCONNECTED);
        return false;
    }

    /**
     * @return true if both connection and channel are open
     */
    public boolean isActive() {
        boolean open = connection.isOpen();
        if (!open && state == LifecycleState.CONNECTED) {
            transition(LifecycleState.DISCONNECTED);
        }
        return open;
    }

    /**
     * Drop the current connection but allow later reconnects.
     */
    public void disconnect() {
        connection.close();
        transition(LifecycleState.DISCONNECTED);
    }

    /**
     * Close the connection for good. Later {@link #ensureConnected} calls return false.
     */
    @Override
    public void close() {
        state = LifecycleState.CLOSED;
        connection.close();
    }

    public LifecycleState state() {
        return state;
    }

    public BrokerConnection connection() {
        return connection;
    }

    public ConnectionLifecycleProfile profile() {
        return profile;
    }

    public String name() {
        return name;
    }

    private void transition(LifecycleState next) {
        if (state != LifecycleState.CLOSED) {
            state = next;
        }
    }
}
