package org.burrow.rabbit.consumer;

import com.rabbitmq.client.Channel;
import org.burrow.rabbit.serialization.MessageDeserializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Deserializes a delivery, runs the callback and settles the delivery.
 *
 * <table>
 *   <caption>Settlement (manual ack)</caption>
 *   <tr><th>callback</th><th>nackOnFalse</th><th>requeueOnNack</th><th>result</th></tr>
 *   <tr><td>true</td><td>any</td><td>any</td><td>ack</td></tr>
 *   <tr><td>false</td><td>false</td><td>any</td><td>nothing</td></tr>
 *   <tr><td>false</td><td>true</td><td>false</td><td>nack</td></tr>
 *   <tr><td>false</td><td>true</td><td>true</td><td>nack + requeue</td></tr>
 * </table>
 *
 * <p>With auto-ack nothing is sent back. A body that deserializes to nothing is logged and
 * left unacknowledged, so the broker redelivers it once the channel closes.</p>
 */
public class DeliveryHandler<T> {

    private static final Logger log = LoggerFactory.getLogger(DeliveryHandler.class);

    private final String name;
    private final MessageDeserializer<T> deserializer;
    private final MessageCallback<T> callback;
    private final boolean autoAck;
    private final boolean nackOnFalse;
    private final boolean requeueOnNack;

    public DeliveryHandler(String name, MessageDeserializer<T> deserializer, MessageCallback<T> callback,
                           boolean autoAck, boolean nackOnFalse, boolean requeueOnNack) {
        this.name = name;
        this.deserializer = deserializer;
        this.callback = callback;
        this.autoAck = autoAck;
        this.nackOnFalse = nackOnFalse;
        this.requeueOnNack = requeueOnNack;
    }

    public AckOutcome handle(Channel channel, long deliveryTag, byte[] body) {
        T message = null;
        try {
            message = deserializer.deserialize(body);
        } catch (Exception e) {
            log.warn("[{}] Failed to deserialize delivery {}: {}", name, deliveryTag, e.getMessage());
        }
        if (message == null) {
            log.warn("[{}] Delivery {} produced no message, leaving it unacknowledged", name, deliveryTag);
            return AckOutcome.NOT_DESERIALIZED;
        }

        boolean success;
        try {
            success = callback.onMessage(message);
        } catch (Exception e) {
            log.error("[{}] Message callback failed for delivery {}: {}", name, deliveryTag, e.getMessage(), e);
            success = false;
        }

        if (autoAck) {
            return success ? AckOutcome.AUTO_ACKED : AckOutcome.AUTO_ACKED_FAILED;
        }
        try {
            if (success) {
                channel.basicAck(deliveryTag, false);
                return AckOutcome.ACKED;
            }
            if (!nackOnFalse) {
                log.debug("[{}] Delivery {} not processed, leaving it unacknowledged", name, deliveryTag);
                return AckOutcome.LEFT_UNACKED;
            }
            channel.basicNack(deliveryTag, false, requeueOnNack);
            return requeueOnNack ? AckOutcome.NACKED_REQUEUED : AckOutcome.NACKED;
        } catch (IOException | RuntimeException e) {
            log.error("[{}] Failed to settle delivery {}: {}", name, deliveryTag, e.getMessage());
            return AckOutcome.ACK_FAILED;
        }
    }
}
