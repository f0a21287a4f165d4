package org.burrow.rabbit.consumer;

/**
 * Handles one consumed message.
 *
 * <p>Return true when the message was processed; it is then acknowledged. Returning false
 * (or throwing) leaves the decision to the consumer's nack settings. Calls may come from
 * the client library's dispatch thread, so implementations should not block for long.</p>
 */
@FunctionalInterface
public interface MessageCallback<T> {

    boolean onMessage(T message) throws Exception;
}
