package io.twsbridge.infrastructure.common;

import io.twsbridge.config.ClientConfig;

import java.time.Duration;

/**
 * Backoff schedule for one outage of a gateway session.
 *
 * The connection manager takes a fresh policy when a session drops, asks it
 * for the delay before every handshake attempt and records each failed one.
 * Once {@link #isExhausted()} the manager gives up and reports the outage.
 *
 * Delay before attempt n (counting from zero) is
 * {@code min(maxDelay, initialDelay * multiplier^n)}.
 */
public final class ReconnectionPolicy {

    /** Growth factor between consecutive attempts. */
    public static final double BACKOFF_MULTIPLIER = 2.0;

    private final Duration initialDelay;
    private final Duration maxDelay;
    private final double multiplier;
    private final int maxAttempts;

    private int failures;

    ReconnectionPolicy(Duration initialDelay, Duration maxDelay, double multiplier, int maxAttempts) {
        if (initialDelay == null || initialDelay.isNegative() || initialDelay.isZero()) {
            throw new IllegalArgumentException("Initial delay must be positive");
        }
        if (maxDelay == null || maxDelay.compareTo(initialDelay) < 0) {
            throw new IllegalArgumentException("Max delay cannot be below the initial delay");
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("Multiplier cannot shrink the delay");
        }
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("Max attempts must be positive");
        }
        this.initialDelay = initialDelay;
        this.maxDelay = maxDelay;
        this.multiplier = multiplier;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Schedule for the reconnect settings of a client configuration.
     */
    public static ReconnectionPolicy from(ClientConfig config) {
        return new ReconnectionPolicy(config.reconnectInitialDelay(), config.reconnectMaxDelay(),
            BACKOFF_MULTIPLIER, config.reconnectMaxAttempts());
    }

    /**
     * Delay to wait before the next handshake attempt.
     */
    public synchronized Duration nextDelay() {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, failures);
        if (millis >= maxDelay.toMillis()) {
            return maxDelay;
        }
        return Duration.ofMillis((long) millis);
    }

    public synchronized void recordFailure() {
        failures++;
    }

    /**
     * @return true once every allowed attempt has failed
     */
    public synchronized boolean isExhausted() {
        return failures >= maxAttempts;
    }

    /**
     * @return failed attempts so far in this outage
     */
    public synchronized int failures() {
        return failures;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
