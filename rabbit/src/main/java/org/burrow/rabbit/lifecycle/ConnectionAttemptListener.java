package org.burrow.rabbit.lifecycle;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Receives the outcome of connection attempts. Failures are reported here instead of
 * being thrown to the caller of {@link ConnectionLifecycleManager#ensureConnected}.
 */
public interface ConnectionAttemptListener {

    /**
     * Default sink: failures at WARN, successes at INFO.
     */
    ConnectionAttemptListener LOGGING = new ConnectionAttemptListener() {
        private final Logger log = LoggerFactory.getLogger(ConnectionAttemptListener.class);

        @Override
        public void onConnected(String name, String broker, int attempt) {
            log.info("[{}] Connected to {} (attempt {})", name, broker, attempt);
        }

        @Override
        public void onAttemptFailed(String name, String broker, int attempt, Exception cause) {
            log.warn("[{}] Connection attempt {} to {} failed: {}", name, attempt, broker, cause.getMessage());
        }
    };

    void onConnected(String name, String broker, int attempt);

    void onAttemptFailed(String name, String broker, int attempt, Exception cause);
}
