package org.burrow.rabbit.consumer;

/**
 * What happened to a delivery after the callback ran.
 */
public enum AckOutcome {
    /** Callback returned true, delivery acked. */
    ACKED,
    /** Callback returned false, delivery nacked and dropped (or dead-lettered). */
    NACKED,
    /** Callback returned false, delivery nacked and requeued. */
    NACKED_REQUEUED,
    /** Callback returned false and nack-on-false is off: neither acked nor nacked. */
    LEFT_UNACKED,
    /** Auto-ack consumer, callback returned true. */
    AUTO_ACKED,
    /** Auto-ack consumer, callback returned false; the broker already forgot the delivery. */
    AUTO_ACKED_FAILED,
    /** Body could not be turned into a payload; delivery left unacknowledged. */
    NOT_DESERIALIZED,
    /** The ack or nack itself failed, usually because the channel closed. */
    ACK_FAILED;

    /**
     * @return true if the callback succeeded and the delivery is settled
     */
    public boolean isSuccess() {
        return this == ACKED || this == AUTO_ACKED;
    }
}
