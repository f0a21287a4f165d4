package org.burrow.rabbit.config;

import java.time.Duration;

/**
 * Everything a publisher needs besides its callbacks.
 *
 * @param endpoint            broker to connect to
 * @param exchange            exchange messages are published to
 * @param exchangeDeclaration declaration run on connect, or null to skip it
 * @param enableAcks          put the channel in confirm mode and wait for broker acks
 * @param contentType         default content type of published messages
 * @param maxQueueDepth       queueing publisher limit, negative for unbounded
 * @param confirmTimeout      how long to wait for a publisher confirm
 */
public record PublisherSettings(
        BrokerEndpoint endpoint,
        String exchange,
        ExchangeDeclaration exchangeDeclaration,
        boolean enableAcks,
        String contentType,
        int maxQueueDepth,
        Duration confirmTimeout
) {
    public static final String DEFAULT_CONTENT_TYPE = "application/json";
    public static final Duration DEFAULT_CONFIRM_TIMEOUT = Duration.ofSeconds(5);

    public PublisherSettings {
        if (endpoint == null) {
            throw new IllegalArgumentException("Publisher endpoint is required");
        }
        if (exchange == null) {
            throw new IllegalArgumentException("Publisher exchange is required");
        }
        contentType = contentType == null ? DEFAULT_CONTENT_TYPE : contentType;
        confirmTimeout = confirmTimeout == null ? DEFAULT_CONFIRM_TIMEOUT : confirmTimeout;
    }

    public PublisherSettings(BrokerEndpoint endpoint, String exchange) {
        this(endpoint, exchange, null, false, DEFAULT_CONTENT_TYPE, -1, DEFAULT_CONFIRM_TIMEOUT);
    }

    public PublisherSettings withAcks(boolean enableAcks) {
        return new PublisherSettings(endpoint, exchange, exchangeDeclaration, enableAcks,
                contentType, maxQueueDepth, confirmTimeout);
    }

    public PublisherSettings withMaxQueueDepth(int maxQueueDepth) {
        return new PublisherSettings(endpoint, exchange, exchangeDeclaration, enableAcks,
                contentType, maxQueueDepth, confirmTimeout);
    }

    public PublisherSettings withExchangeDeclaration(ExchangeDeclaration declaration) {
        return new PublisherSettings(endpoint, exchange, declaration, enableAcks,
                contentType, maxQueueDepth, confirmTimeout);
    }
}
