package org.burrow.rabbit.consumer;

import org.burrow.rabbit.config.BrokerEndpoint;
import org.burrow.rabbit.config.ConsumerSettings;
import org.burrow.rabbit.lifecycle.WorkerState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class SimulatedConsumerTest {

    private static final ConsumerSettings SETTINGS =
            new ConsumerSettings(new BrokerEndpoint("amqp://localhost"), "TestExchange", "TestQueue");
    private static final Duration INTERVAL = Duration.ofMillis(20);
    private static final Duration GRACE = Duration.ofMillis(200);

    private SimulatedConsumer<String> consumer;

    @AfterEach
    void tearDown() {
        if (consumer != null) {
            consumer.shutdown(Duration.ofMillis(200));
        }
    }

    @Test
    void deliversSuppliedPayloadsUntilShutdown() throws Exception {
        var counter = new AtomicInteger();
        var received = new CopyOnWriteArrayList<String>();
        var threeSeen = new CountDownLatch(3);
        consumer = new SimulatedConsumer<>("orders", SETTINGS, () -> "m" + counter.incrementAndGet(), m -> {
            received.add(m);
            threeSeen.countDown();
            return true;
        }, INTERVAL, GRACE);

        assertTrue(consumer.isActive());
        consumer.start();
        assertTrue(threeSeen.await(5, TimeUnit.SECONDS));
        assertTrue(consumer.shutdown(Duration.ofSeconds(2)));

        assertEquals(List.of("m1", "m2", "m3"), received.subList(0, 3));
        assertEquals(WorkerState.STOPPED, consumer.state());
        int afterShutdown = received.size();
        Thread.sleep(100);
        assertEquals(afterShutdown, received.size());
        assertEquals(afterShutdown, consumer.consumedCount());
    }

    @Test
    void failingCallbackAndNullPayloadsDoNotStopTheWorker() throws Exception {
        var counter = new AtomicInteger();
        var survived = new CountDownLatch(1);
        consumer = new SimulatedConsumer<>("orders", SETTINGS, () -> {
            int n = counter.incrementAndGet();
            return n == 1 ? null : "m" + n;
        }, m -> {
            if (m.equals("m2")) {
                throw new IllegalStateException("boom");
            }
            survived.countDown();
            return true;
        }, INTERVAL, GRACE);

        consumer.start();
        assertTrue(survived.await(5, TimeUnit.SECONDS));
        assertTrue(consumer.shutdown(Duration.ofSeconds(2)));
    }

    @Test
    void blockedCallbackIsForcedAfterTheTimeout() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        consumer = new SimulatedConsumer<>("orders", SETTINGS, () -> "stuck", m -> {
            entered.countDown();
            release.await();
            return true;
        }, INTERVAL, GRACE);

        consumer.start();
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        try {
            assertFalse(consumer.shutdown(Duration.ofMillis(100)));
            assertTrue(consumer.isForcedStop());
            assertFalse(consumer.shutdown(Duration.ofMillis(100)));
        } finally {
            release.countDown();
        }
    }

    @Test
    void shutdownBeforeStartIsClean() {
        consumer = new SimulatedConsumer<>("orders", SETTINGS, () -> "m", m -> true);

        assertTrue(consumer.shutdown(Duration.ofSeconds(1)));
        assertEquals("orders", consumer.getName());
        assertSame(SETTINGS, consumer.getSettings());
    }
}
