package io.twsbridge.infrastructure.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.*;
import java.util.function.Consumer;

/**
 * Liveness check for one gateway session.
 *
 * The gateway protocol has no ping frame, so the ping function sends a cheap
 * request (current time) and every inbound frame counts as a pong. When nothing
 * arrives within the timeout the health callback receives false.
 *
 * One instance per session: a stopped manager cannot be restarted.
 *
 * <pre>
 * HeartbeatManager heartbeat = new HeartbeatManager(
 *     "127.0.0.1:7496/12",
 *     Duration.ofSeconds(30),
 *     Duration.ofSeconds(60),
 *     () -> send(new CurrentTimeRequest()),
 *     healthy -> { if (!healthy) onConnectionLost(); });
 * heartbeat.start();
 * // for each inbound frame:
 * heartbeat.recordPong();
 * </pre>
 */
public class HeartbeatManager {

    private static final Logger log = LoggerFactory.getLogger(HeartbeatManager.class);

    private final String sessionLabel;
    private final Duration pingInterval;
    private final Duration timeout;
    private final Runnable pingFunction;
    private final Consumer<Boolean> healthCallback;

    private final ScheduledExecutorService scheduler;
    private volatile ScheduledFuture<?> pingTask;
    private volatile ScheduledFuture<?> timeoutTask;
    private volatile Instant lastPongTime;
    private volatile boolean running = false;
    private volatile boolean healthy = true;

    public HeartbeatManager(String sessionLabel, Duration pingInterval, Duration timeout,
                            Runnable pingFunction, Consumer<Boolean> healthCallback) {
        if (pingInterval.isNegative() || pingInterval.isZero()) {
            throw new IllegalArgumentException("Ping interval must be positive");
        }
        if (timeout.compareTo(pingInterval) < 0) {
            throw new IllegalArgumentException("Heartbeat timeout cannot be shorter than the ping interval");
        }
        this.sessionLabel = sessionLabel;
        this.pingInterval = pingInterval;
        this.timeout = timeout;
        this.pingFunction = pingFunction;
        this.healthCallback = healthCallback;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tws-heartbeat-" + sessionLabel);
            t.setDaemon(true);
            return t;
        });
    }

    public synchronized void start() {
        if (running) {
            log.warn("[TWS:{}] Heartbeat already running", sessionLabel);
            return;
        }

        log.debug("[TWS:{}] Starting heartbeat (interval={}ms, timeout={}ms)",
            sessionLabel, pingInterval.toMillis(), timeout.toMillis());

        running = true;
        healthy = true;
        lastPongTime = Instant.now();

        pingTask = scheduler.scheduleAtFixedRate(() -> {
            try {
                sendPing();
            } catch (Exception e) {
                log.error("[TWS:{}] Failed to send heartbeat", sessionLabel, e);
                markUnhealthy();
            }
        }, pingInterval.toMillis(), pingInterval.toMillis(), TimeUnit.MILLISECONDS);
    }

    public synchronized void stop() {
        if (!running) {
            scheduler.shutdownNow();
            return;
        }

        log.debug("[TWS:{}] Stopping heartbeat", sessionLabel);
        running = false;

        if (pingTask != null) {
            pingTask.cancel(false);
            pingTask = null;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
            timeoutTask = null;
        }

        scheduler.shutdownNow();
    }

    /**
     * Any inbound frame proves the session is alive.
     */
    public void recordPong() {
        lastPongTime = Instant.now();
        if (!healthy && running) {
            synchronized (this) {
                if (!healthy) {
                    log.info("[TWS:{}] Session responsive again", sessionLabel);
                    markHealthy();
                }
            }
        }
    }

    public boolean isHealthy() {
        return healthy && isWithinTimeout();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * @return time since the last inbound frame, or null before start
     */
    public Duration getTimeSinceLastPong() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return null;
        }
        return Duration.between(lastPong, Instant.now());
    }

    private void sendPing() {
        if (!running) {
            return;
        }

        log.trace("[TWS:{}] Heartbeat ping", sessionLabel);
        pingFunction.run();
        scheduleTimeoutCheck();
    }

    private synchronized void scheduleTimeoutCheck() {
        if (!running) {
            return;
        }
        if (timeoutTask != null) {
            timeoutTask.cancel(false);
        }

        timeoutTask = scheduler.schedule(() -> {
            if (isWithinTimeout()) {
                return;
            }
            log.warn("[TWS:{}] Heartbeat timeout - nothing received for {}ms",
                sessionLabel, timeout.toMillis());
            markUnhealthy();
        }, timeout.toMillis(), TimeUnit.MILLISECONDS);
    }

    private boolean isWithinTimeout() {
        Instant lastPong = lastPongTime;
        if (lastPong == null) {
            return false;
        }
        return Duration.between(lastPong, Instant.now()).compareTo(timeout) < 0;
    }

    private void markHealthy() {
        if (healthy) {
            return;
        }
        healthy = true;
        notifyHealth(true);
    }

    private void markUnhealthy() {
        if (!healthy) {
            return;
        }
        healthy = false;
        notifyHealth(false);
    }

    private void notifyHealth(boolean isHealthy) {
        if (healthCallback == null) {
            return;
        }
        try {
            healthCallback.accept(isHealthy);
        } catch (Exception e) {
            log.error("[TWS:{}] Heartbeat health callback threw exception", sessionLabel, e);
        }
    }
}
