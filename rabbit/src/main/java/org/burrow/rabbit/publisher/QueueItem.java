package org.burrow.rabbit.publisher;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One pending publication: the payload plus everything needed to send it.
 *
 * @param payload         message to serialize
 * @param routingKey      routing key
 * @param contentType     AMQP content type property
 * @param contentEncoding AMQP content encoding property
 * @param headers         AMQP headers, may be null; copied on construction
 */
public record QueueItem<T>(
        T payload,
        String routingKey,
        String contentType,
        String contentEncoding,
        Map<String, Object> headers
) {
    public static final String DEFAULT_CONTENT_ENCODING = "utf-8";

    public QueueItem {
        headers = headers == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public QueueItem(T payload, String routingKey, String contentType, Map<String, Object> headers) {
        this(payload, routingKey, contentType, DEFAULT_CONTENT_ENCODING, headers);
    }
}
