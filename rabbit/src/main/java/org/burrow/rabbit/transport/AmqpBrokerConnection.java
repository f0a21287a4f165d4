package org.burrow.rabbit.transport;

import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import org.burrow.rabbit.config.BrokerEndpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Optional;
import java.util.concurrent.TimeoutException;

/**
 * {@link BrokerConnection} backed by the RabbitMQ Java client.
 *
 * <p>The {@link ConnectionFactory} is built once in the constructor, so a malformed URI
 * or broken TLS material fails fast with {@link TransportException} instead of being
 * retried forever.</p>
 */
public class AmqpBrokerConnection implements BrokerConnection {

    private static final Logger log = LoggerFactory.getLogger(AmqpBrokerConnection.class);

    private final BrokerEndpoint endpoint;
    private final ConnectionFactory factory;

    private volatile Connection connection;
    private volatile Channel channel;

    public AmqpBrokerConnection(BrokerEndpoint endpoint) {
        this(endpoint, new ConnectionFactory());
    }

    AmqpBrokerConnection(BrokerEndpoint endpoint, ConnectionFactory factory) {
        this.endpoint = endpoint;
        this.factory = configure(factory, endpoint);
    }

    @Override
    public void open() throws IOException, TimeoutException {
        close();
        Connection newConnection = factory.newConnection(endpoint.clientName());
        try {
            channel = newConnection.createChannel();
        } catch (IOException | RuntimeException e) {
            closeQuietly(newConnection);
            throw e;
        }
        if (channel == null) {
            closeQuietly(newConnection);
            throw new IOException("No channel available on connection to " + describe());
        }
        connection = newConnection;
    }

    @Override
    public boolean isOpen() {
        Connection c = connection;
        Channel ch = channel;
        return c != null && c.isOpen() && ch != null && ch.isOpen();
    }

    @Override
    public Channel channel() {
        return channel;
    }

    @Override
    public String describe() {
        return endpoint.displayName();
    }

    @Override
    public void close() {
        Channel ch = channel;
        Connection c = connection;
        channel = null;
        connection = null;
        try { if (ch != null && ch.isOpen()) ch.close(); }
        catch (Exception e) { log.debug("Error closing channel to {}: {}", describe(), e.getMessage()); }
        closeQuietly(c);
    }

    private void closeQuietly(Connection c) {
        try { if (c != null && c.isOpen()) c.close(); }
        catch (Exception e) { log.debug("Error closing connection to {}: {}", describe(), e.getMessage()); }
    }

    static ConnectionFactory configure(ConnectionFactory factory, BrokerEndpoint endpoint) {
        try {
            factory.setUri(endpoint.uri());
        } catch (URISyntaxException | GeneralSecurityException | IllegalArgumentException e) {
            throw new TransportException("Invalid broker URI for " + endpoint.displayName(), e);
        }

        factory.setAutomaticRecoveryEnabled(endpoint.automaticRecovery());
        factory.setTopologyRecoveryEnabled(endpoint.automaticRecovery());

        Optional<SSLContext> sslContext = TlsSupport.fromKeysDirectory(endpoint.keysPath());
        sslContext.ifPresent(factory::useSslProtocol);
        return factory;
    }
}
