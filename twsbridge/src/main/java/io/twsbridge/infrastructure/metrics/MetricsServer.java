package io.twsbridge.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Embedded Undertow server exposing GET /metrics.
 */
public class MetricsServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final CollectorRegistry registry;
    private Undertow server;

    public MetricsServer(int port, CollectorRegistry registry) {
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("Metrics port out of range: " + port);
        }
        this.port = port;
        this.registry = registry;
    }

    public synchronized void start() {
        if (server != null) {
            return;
        }
        server = Undertow.builder()
            .addHttpListener(port, "0.0.0.0")
            .setHandler(Handlers.routing()
                .get("/metrics", new PrometheusMetricsHandler(registry)))
            .build();
        server.start();
        log.info("[MetricsServer] Serving /metrics on port {}", port);
    }

    public synchronized void stop() {
        if (server == null) {
            return;
        }
        server.stop();
        server = null;
        log.info("[MetricsServer] Stopped");
    }

    public int getPort() {
        return port;
    }

    @Override
    public void close() {
        stop();
    }
}
