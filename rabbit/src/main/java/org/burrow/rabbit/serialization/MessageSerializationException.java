package org.burrow.rabbit.serialization;

public class MessageSerializationException extends RuntimeException {

    public MessageSerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
