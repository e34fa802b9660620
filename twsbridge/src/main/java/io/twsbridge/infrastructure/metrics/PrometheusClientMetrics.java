package io.twsbridge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;

import java.time.Duration;

/**
 * Prometheus implementation of {@link ClientMetrics}.
 *
 * Key Metrics:
 * - tws_connection_events_total{session, event}
 * - tws_connect_failures_total{session, reason}
 * - tws_connected{session} - 1 while a session is up
 * - tws_frames_received_total{type}
 * - tws_protocol_errors_total
 * - tws_requests_total{type}
 * - tws_request_timeouts_total{type}
 * - tws_request_latency_seconds{type}
 * - tws_order_status_updates_total{state}
 * - tws_quotes_total
 * - tws_resubscriptions_total
 *
 * Usage:
 * <pre>
 * PrometheusClientMetrics metrics = new PrometheusClientMetrics(new CollectorRegistry());
 * TwsClient client = new TwsClient(config, metrics);
 *
 * MetricsServer server = new MetricsServer(9464, metrics.getRegistry());
 * server.start();
 * </pre>
 */
public class PrometheusClientMetrics implements ClientMetrics {

    private final CollectorRegistry registry;

    // Connection metrics
    private final Counter connectionEventCounter;
    private final Counter connectFailureCounter;
    private final Gauge connectionStatus;

    // Wire metrics
    private final Counter frameCounter;
    private final Counter protocolErrorCounter;

    // Request metrics
    private final Counter requestCounter;
    private final Counter requestTimeoutCounter;
    private final Histogram requestLatency;

    // Order and market data metrics
    private final Counter orderStatusCounter;
    private final Counter quoteCounter;
    private final Counter resubscriptionCounter;

    public PrometheusClientMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusClientMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.connectionEventCounter = Counter.build()
            .name("tws_connection_events_total")
            .help("Connection lifecycle events")
            .labelNames("session", "event")
            .register(registry);

        this.connectFailureCounter = Counter.build()
            .name("tws_connect_failures_total")
            .help("Failed connection attempts by reason")
            .labelNames("session", "reason")
            .register(registry);

        this.connectionStatus = Gauge.build()
            .name("tws_connected")
            .help("Session status (1=connected, 0=not connected)")
            .labelNames("session")
            .register(registry);

        this.frameCounter = Counter.build()
            .name("tws_frames_received_total")
            .help("Decoded inbound frames by message type")
            .labelNames("type")
            .register(registry);

        this.protocolErrorCounter = Counter.build()
            .name("tws_protocol_errors_total")
            .help("Inbound frames that failed to decode")
            .register(registry);

        this.requestCounter = Counter.build()
            .name("tws_requests_total")
            .help("Outbound requests by type")
            .labelNames("type")
            .register(registry);

        this.requestTimeoutCounter = Counter.build()
            .name("tws_request_timeouts_total")
            .help("Oneshot requests that timed out")
            .labelNames("type")
            .register(registry);

        this.requestLatency = Histogram.build()
            .name("tws_request_latency_seconds")
            .help("Time from request to terminal response in seconds")
            .labelNames("type")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0)
            .register(registry);

        this.orderStatusCounter = Counter.build()
            .name("tws_order_status_updates_total")
            .help("Applied order status updates by resulting state")
            .labelNames("state")
            .register(registry);

        this.quoteCounter = Counter.build()
            .name("tws_quotes_total")
            .help("Quotes appended to streaming buffers")
            .register(registry);

        this.resubscriptionCounter = Counter.build()
            .name("tws_resubscriptions_total")
            .help("Subscription requests re-sent after reconnect")
            .register(registry);
    }

    @Override
    public void recordConnectionEvent(String session, String event) {
        connectionEventCounter.labels(session, event).inc();
    }

    @Override
    public void recordConnectFailure(String session, String reason) {
        connectFailureCounter.labels(session, reason).inc();
    }

    @Override
    public void setConnected(String session, boolean connected) {
        connectionStatus.labels(session).set(connected ? 1 : 0);
    }

    @Override
    public void recordFrameReceived(String messageType) {
        frameCounter.labels(messageType).inc();
    }

    @Override
    public void recordProtocolError() {
        protocolErrorCounter.inc();
    }

    @Override
    public void recordRequestSent(String requestType) {
        requestCounter.labels(requestType).inc();
    }

    @Override
    public void recordRequestTimeout(String requestType) {
        requestTimeoutCounter.labels(requestType).inc();
    }

    @Override
    public void recordRequestLatency(String requestType, Duration latency) {
        requestLatency.labels(requestType).observe(latency.toNanos() / 1_000_000_000.0);
    }

    @Override
    public void recordOrderStatus(String state) {
        orderStatusCounter.labels(state).inc();
    }

    @Override
    public void recordQuote() {
        quoteCounter.inc();
    }

    @Override
    public void recordResubscriptions(int count) {
        resubscriptionCounter.inc(count);
    }

    /**
     * Get Prometheus registry for exposing metrics.
     */
    public CollectorRegistry getRegistry() {
        return registry;
    }
}
