package org.burrow.rabbit.serialization;

/**
 * Turns a message body back into a payload.
 *
 * <p>Returning null means "no value"; the delivery is then left unacknowledged.</p>
 */
@FunctionalInterface
public interface MessageDeserializer<T> {

    T deserialize(byte[] body) throws Exception;
}
