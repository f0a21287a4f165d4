package org.burrow.rabbit.transport;

/**
 * Raised for broker configuration mistakes that retrying cannot fix,
 * such as a malformed URI or unreadable TLS material.
 */
public class TransportException extends RuntimeException {

    public TransportException(String message) {
        super(message);
    }

    public TransportException(String message, Throwable cause) {
        super(message, cause);
    }
}
