package io.twsbridge.infrastructure.metrics;

import java.time.Duration;

/**
 * Client metrics for monitoring and alerting.
 *
 * Implementations can publish to Prometheus or anything else; every caller
 * treats a null metrics reference as "metrics disabled".
 *
 * Key metrics:
 * - Connection drops and reconnects
 * - Inbound frames per message type
 * - Protocol errors
 * - Request round-trip latency and timeouts
 * - Quote throughput
 */
public interface ClientMetrics {

    /**
     * Record a connection lifecycle event.
     *
     * @param session Session label (host:port/clientId)
     * @param event CONNECTED, LOST, RECONNECTED, RECONNECT_FAILED, DISCONNECTED, CYCLED
     */
    void recordConnectionEvent(String session, String event);

    /**
     * Record connect failure by reason (REFUSED, TIMEOUT, VERSION_MISMATCH).
     */
    void recordConnectFailure(String session, String reason);

    /**
     * Update the connection state gauge (1 connected, 0 otherwise).
     */
    void setConnected(String session, boolean connected);

    /**
     * Record a decoded inbound frame.
     *
     * @param messageType Simple event type name
     */
    void recordFrameReceived(String messageType);

    /**
     * Record a frame that could not be decoded.
     */
    void recordProtocolError();

    /**
     * Record an outbound request.
     */
    void recordRequestSent(String requestType);

    /**
     * Record a oneshot request that ran out of time.
     */
    void recordRequestTimeout(String requestType);

    /**
     * Record time from send to terminal response.
     */
    void recordRequestLatency(String requestType, Duration latency);

    /**
     * Record an applied order status update.
     *
     * @param state Order state after the update
     */
    void recordOrderStatus(String state);

    /**
     * Record a quote appended to a streaming buffer.
     */
    void recordQuote();

    /**
     * Record subscription requests re-sent after a reconnect.
     */
    void recordResubscriptions(int count);
}
