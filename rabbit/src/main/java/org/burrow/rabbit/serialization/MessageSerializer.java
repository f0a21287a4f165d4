package org.burrow.rabbit.serialization;

/**
 * Turns a payload into a message body.
 */
@FunctionalInterface
public interface MessageSerializer<T> {

    /**
     * @throws MessageSerializationException if the payload cannot be serialized
     */
    byte[] serialize(T payload);
}
