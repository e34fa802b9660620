package io.twsbridge.application.correlation;

import org.junit.jupiter.api.Test;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestIdGenerator.
 */
class RequestIdGeneratorTest {

    @Test
    void testSequentialIds() {
        RequestIdGenerator ids = new RequestIdGenerator();

        assertEquals(1, ids.next());
        assertEquals(2, ids.next());
        assertEquals(3, ids.peek(), "Peek does not consume");
        assertEquals(3, ids.next());
    }

    @Test
    void testAdvanceOnlyMovesForward() {
        RequestIdGenerator ids = new RequestIdGenerator(10);

        ids.advanceTo(5);
        assertEquals(10, ids.next(), "A lower gateway id never rewinds the counter");

        ids.advanceTo(1000);
        assertEquals(1000, ids.next());
        assertEquals(1001, ids.next());
    }

    @Test
    void testInitialMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new RequestIdGenerator(0));
    }

    @Test
    void testConcurrentCallersNeverShareAnId() throws InterruptedException {
        RequestIdGenerator ids = new RequestIdGenerator();
        Set<Long> seen = ConcurrentHashMap.newKeySet();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch done = new CountDownLatch(8);

        for (int t = 0; t < 8; t++) {
            pool.execute(() -> {
                for (int i = 0; i < 1000; i++) {
                    seen.add(ids.next());
                }
                done.countDown();
            });
        }

        assertTrue(done.await(5, TimeUnit.SECONDS));
        pool.shutdown();
        assertEquals(8000, seen.size(), "Every id handed out exactly once");
    }
}
