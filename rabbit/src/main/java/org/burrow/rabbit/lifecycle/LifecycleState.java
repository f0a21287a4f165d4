package org.burrow.rabbit.lifecycle;

/**
 * Connection state of a single publisher or consumer.
 */
public enum LifecycleState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Terminal, after an explicit close. */
    CLOSED
}
