package io.twsbridge.infrastructure.common;

import io.twsbridge.config.ClientConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ReconnectionPolicy.
 *
 * Tests cover:
 * - Exponential growth capped at the max delay
 * - Give-up state after the configured attempts
 * - Construction from a client configuration
 */
class ReconnectionPolicyTest {

    @Test
    void testDelayDoublesPerFailure() {
        ReconnectionPolicy policy = new ReconnectionPolicy(
            Duration.ofMillis(100), Duration.ofSeconds(10), 2.0, 5);

        assertEquals(Duration.ofMillis(100), policy.nextDelay(), "First attempt waits the initial delay");
        policy.recordFailure();
        assertEquals(Duration.ofMillis(200), policy.nextDelay(), "Second attempt doubles");
        policy.recordFailure();
        assertEquals(Duration.ofMillis(400), policy.nextDelay(), "Third attempt doubles again");
    }

    @Test
    void testDelayIsCappedAtMax() {
        ReconnectionPolicy policy = new ReconnectionPolicy(
            Duration.ofMillis(500), Duration.ofSeconds(1), 2.0, 10);

        for (int i = 0; i < 6; i++) {
            policy.recordFailure();
        }

        assertEquals(Duration.ofSeconds(1), policy.nextDelay(), "Delay never exceeds the cap");
    }

    @Test
    void testExhaustedAfterMaxAttempts() {
        ReconnectionPolicy policy = new ReconnectionPolicy(
            Duration.ofMillis(10), Duration.ofMillis(50), 2.0, 3);

        assertFalse(policy.isExhausted(), "Fresh policy has attempts left");
        policy.recordFailure();
        policy.recordFailure();
        assertFalse(policy.isExhausted(), "Two of three attempts used");
        policy.recordFailure();

        assertTrue(policy.isExhausted(), "All attempts used");
        assertEquals(3, policy.failures());
    }

    @Test
    void testFromClientConfig() {
        ClientConfig config = ClientConfig.builder()
            .reconnectInitialDelay(Duration.ofMillis(250))
            .reconnectMaxDelay(Duration.ofSeconds(2))
            .reconnectMaxAttempts(4)
            .build();

        ReconnectionPolicy policy = ReconnectionPolicy.from(config);

        assertEquals(Duration.ofMillis(250), policy.nextDelay(), "Initial delay comes from the config");
        assertEquals(4, policy.maxAttempts(), "Attempt budget comes from the config");
        policy.recordFailure();
        assertEquals(Duration.ofMillis(500), policy.nextDelay(),
            "Growth uses the default multiplier " + ReconnectionPolicy.BACKOFF_MULTIPLIER);
    }

    @Test
    void testRejectsInvalidSettings() {
        assertThrows(IllegalArgumentException.class,
            () -> new ReconnectionPolicy(Duration.ZERO, Duration.ofSeconds(1), 2.0, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new ReconnectionPolicy(Duration.ofSeconds(2), Duration.ofSeconds(1), 2.0, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new ReconnectionPolicy(Duration.ofMillis(1), Duration.ofSeconds(1), 0.5, 3));
        assertThrows(IllegalArgumentException.class,
            () -> new ReconnectionPolicy(Duration.ofMillis(1), Duration.ofSeconds(1), 2.0, 0));
    }
}
