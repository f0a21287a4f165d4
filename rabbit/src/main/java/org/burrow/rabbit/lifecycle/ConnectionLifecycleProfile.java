package org.burrow.rabbit.lifecycle;

import java.time.Duration;

/**
 * Retry policy applied whenever a publisher or consumer has to (re)connect.
 *
 * @param maxRetries     retries after the first attempt: negative retries forever, 0 never retries
 * @param reconnectDelay pause between attempts
 */
public record ConnectionLifecycleProfile(int maxRetries, Duration reconnectDelay) {

    public static final Duration DEFAULT_RECONNECT_DELAY = Duration.ofSeconds(5);

    public ConnectionLifecycleProfile {
        if (reconnectDelay == null || reconnectDelay.isNegative()) {
            throw new IllegalArgumentException("reconnectDelay must be zero or positive");
        }
    }

    /** Retry forever, 5 seconds apart. */
    public static ConnectionLifecycleProfile defaults() {
        return new ConnectionLifecycleProfile(-1, DEFAULT_RECONNECT_DELAY);
    }

    public static ConnectionLifecycleProfile noRetry() {
        return new ConnectionLifecycleProfile(0, Duration.ZERO);
    }

    public boolean retriesForever() {
        return maxRetries < 0;
    }

    /**
     * Whether another attempt is allowed after {@code failedAttempts} failures.
     */
    boolean allowsAnotherAttempt(int failedAttempts) {
        return retriesForever() || failedAttempts <= maxRetries;
    }
}
