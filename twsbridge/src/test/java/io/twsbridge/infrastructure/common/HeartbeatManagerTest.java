package io.twsbridge.infrastructure.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for HeartbeatManager.
 *
 * Tests:
 * - Periodic ping sending
 * - Pong receipt keeps the session healthy
 * - Timeout detection and recovery callbacks
 * - Lifecycle management
 */
class HeartbeatManagerTest {

    private HeartbeatManager heartbeat;

    @AfterEach
    void tearDown() {
        if (heartbeat != null) {
            heartbeat.stop();
        }
    }

    @Test
    void testNoPingBeforeStart() {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofSeconds(1), Duration.ofSeconds(2),
            pingCount::incrementAndGet, healthy -> {});

        assertEquals(0, pingCount.get(), "No pings sent before start");
        assertNull(heartbeat.getTimeSinceLastPong(), "No pongs received yet");
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void testPeriodicPingSending() throws InterruptedException {
        CountDownLatch pingLatch = new CountDownLatch(3);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(100), Duration.ofSeconds(1),
            pingLatch::countDown, healthy -> {});
        heartbeat.start();

        assertTrue(pingLatch.await(2, TimeUnit.SECONDS), "Should send 3 pings within 2 seconds");
    }

    @Test
    void testPongKeepsSessionHealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(50), Duration.ofMillis(300),
            () -> {},
            healthy -> {
                if (!healthy) {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        // Inbound traffic every 50ms
        for (int i = 0; i < 12; i++) {
            heartbeat.recordPong();
            Thread.sleep(50);
        }

        assertEquals(1, unhealthy.getCount(), "Regular frames should prevent a timeout");
        assertTrue(heartbeat.isHealthy());
    }

    @Test
    void testTimeoutMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(100), Duration.ofMillis(300),
            () -> {},
            healthy -> {
                if (!healthy) {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS), "Silence should be detected as a timeout");
        assertFalse(heartbeat.isHealthy());
    }

    @Test
    void testRecoveryAfterTimeout() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);
        CountDownLatch recovered = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(100), Duration.ofMillis(250),
            () -> {},
            healthy -> {
                if (healthy) {
                    recovered.countDown();
                } else {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        assertTrue(unhealthy.await(2, TimeUnit.SECONDS));
        heartbeat.recordPong();
        assertTrue(recovered.await(1, TimeUnit.SECONDS), "A frame after the timeout should restore health");
    }

    @Test
    void testFailingPingMarksUnhealthy() throws InterruptedException {
        CountDownLatch unhealthy = new CountDownLatch(1);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(50), Duration.ofSeconds(5),
            () -> {
                throw new IllegalStateException("socket closed");
            },
            healthy -> {
                if (!healthy) {
                    unhealthy.countDown();
                }
            });
        heartbeat.start();

        assertTrue(unhealthy.await(1, TimeUnit.SECONDS), "A ping that cannot be sent means the session is gone");
    }

    @Test
    void testStopHaltsPings() throws InterruptedException {
        AtomicInteger pingCount = new AtomicInteger(0);

        heartbeat = new HeartbeatManager("127.0.0.1:7496/1", Duration.ofMillis(50), Duration.ofSeconds(1),
            pingCount::incrementAndGet, healthy -> {});
        heartbeat.start();
        Thread.sleep(200);
        heartbeat.stop();

        int afterStop = pingCount.get();
        Thread.sleep(200);
        assertEquals(afterStop, pingCount.get(), "No pings after stop");
        assertFalse(heartbeat.isRunning());
    }

    @Test
    void testTimeoutShorterThanIntervalRejected() {
        assertThrows(IllegalArgumentException.class,
            () -> new HeartbeatManager("s", Duration.ofSeconds(2), Duration.ofSeconds(1), () -> {}, h -> {}));
    }
}
