package org.burrow.rabbit.consumer;

import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.lifecycle.BackgroundWorker;
import org.burrow.rabbit.lifecycle.CancellationToken;
import org.burrow.rabbit.lifecycle.WorkerState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Consumer that never touches a broker. Its worker makes a payload with the supplier once
 * per interval (1 s by default) and hands it to the callback, so the rest of an application
 * can run without RabbitMQ. Shutdown follows the same timeout and forced-stop protocol as
 * {@link ContinuousConsumer}.
 */
public class SimulatedConsumer<T> implements RabbitConsumer<T> {

    private static final Logger log = LoggerFactory.getLogger(SimulatedConsumer.class);

    public static final Duration INTERVAL = Duration.ofSeconds(1);

    private final String name;
    private final ConsumerSettings settings;
    private final Supplier<T> payloads;
    private final MessageCallback<T> callback;
    private final Duration interval;
    private final BackgroundWorker worker;
    private final AtomicLong consumed = new AtomicLong();

    public SimulatedConsumer(String name, ConsumerSettings settings, Supplier<T> payloads,
                             MessageCallback<T> callback) {
        this(name, settings, payloads, callback, INTERVAL, BackgroundWorker.FORCED_STOP_GRACE);
    }

    public SimulatedConsumer(String name, ConsumerSettings settings, Supplier<T> payloads,
                             MessageCallback<T> callback, Duration interval, Duration forcedStopGrace) {
        this.name = name;
        this.settings = settings;
        this.payloads = payloads;
        this.callback = callback;
        this.interval = interval;
        this.worker = new BackgroundWorker("burrow-consumer-" + name, this::run, forcedStopGrace);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public ConsumerSettings getSettings() {
        return settings;
    }

    @Override
    public boolean isActive() {
        return true;
    }

    @Override
    public void start() {
        if (worker.start()) {
            log.info("[{}] Simulated consumer starting on queue {}", name, settings.queue());
        }
    }

    @Override
    public boolean shutdown(Duration timeout) {
        if (worker.state() == WorkerState.STOPPED) {
            return !worker.isForcedStop();
        }
        log.info("[{}] Simulated consumer shutting down", name);
        boolean clean = worker.shutdown(timeout);
        if (!clean) {
            log.warn("[{}] Timed out shutting down simulated consumer", name);
        }
        return clean;
    }

    @Override
    public void close() {
        shutdown(BackgroundWorker.DEFAULT_SHUTDOWN_TIMEOUT);
    }

    /**
     * @return number of payloads handed to the callback so far
     */
    public long consumedCount() {
        return consumed.get();
    }

    public WorkerState state() {
        return worker.state();
    }

    public boolean isForcedStop() {
        return worker.isForcedStop();
    }

    private void run(CancellationToken stopRequested, CancellationToken forcedStop) {
        while (!stopRequested.isCancelled() && !forcedStop.isCancelled()) {
            try {
                if (stopRequested.await(interval)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
            T payload;
            try {
                payload = payloads.get();
                if (payload == null) {
                    continue;
                }
                callback.onMessage(payload);
                consumed.incrementAndGet();
            } catch (Exception e) {
                log.warn("[{}] Simulated message failed: {}", name, e.getMessage(), e);
                continue;
            }
            log.info("[{}] Simulated consumption of {} [{}] from {}", name,
                    payload.getClass().getSimpleName(), settings.routingKeys().get(0), settings.queue());
        }
        log.debug("[{}] Simulated consumer stopped", name);
    }
}
