package io.twsbridge.config;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Settings for one gateway client.
 *
 * Never built with nulls: {@link #defaults()} fills every field and the builder
 * validates ranges.
 *
 * @param host gateway host
 * @param port gateway API port (7496 live TWS, 7497 paper, 4001/4002 IB Gateway)
 * @param clientId API client id; must be unique per gateway
 * @param connectTimeout bound on socket connect plus handshake
 * @param requestTimeout default bound for oneshot requests
 * @param heartbeatInterval delay between liveness pings
 * @param heartbeatTimeout silence after which the session is considered lost
 * @param reconnectInitialDelay first reconnection backoff
 * @param reconnectMaxDelay backoff cap
 * @param reconnectMaxAttempts attempts before giving up
 * @param autoReconnect reconnect after an unexpected loss
 * @param protocolErrorThreshold consecutive undecodable frames tolerated
 * @param quoteBufferCapacity default capacity for streaming quote buffers
 * @param metricsPort port for the /metrics endpoint, 0 disables it
 */
public record ClientConfig(
    String host,
    int port,
    int clientId,
    Duration connectTimeout,
    Duration requestTimeout,
    Duration heartbeatInterval,
    Duration heartbeatTimeout,
    Duration reconnectInitialDelay,
    Duration reconnectMaxDelay,
    int reconnectMaxAttempts,
    boolean autoReconnect,
    int protocolErrorThreshold,
    int quoteBufferCapacity,
    int metricsPort
) {
    public static final String DEFAULT_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 7496;

    public ClientConfig {
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("host cannot be blank");
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("port out of range: " + port);
        }
        requirePositive(connectTimeout, "connectTimeout");
        requirePositive(requestTimeout, "requestTimeout");
        requirePositive(heartbeatInterval, "heartbeatInterval");
        requirePositive(heartbeatTimeout, "heartbeatTimeout");
        requirePositive(reconnectInitialDelay, "reconnectInitialDelay");
        requirePositive(reconnectMaxDelay, "reconnectMaxDelay");
        if (heartbeatTimeout.compareTo(heartbeatInterval) < 0) {
            throw new IllegalArgumentException("heartbeatTimeout must not be shorter than heartbeatInterval");
        }
        if (reconnectMaxAttempts <= 0) {
            throw new IllegalArgumentException("reconnectMaxAttempts must be positive");
        }
        if (protocolErrorThreshold <= 0) {
            throw new IllegalArgumentException("protocolErrorThreshold must be positive");
        }
        if (quoteBufferCapacity < 1) {
            throw new IllegalArgumentException("quoteBufferCapacity must be at least 1");
        }
        if (metricsPort < 0 || metricsPort > 65535) {
            throw new IllegalArgumentException("metricsPort out of range: " + metricsPort);
        }
    }

    private static void requirePositive(Duration value, String name) {
        if (value == null || value.isNegative() || value.isZero()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
    }

    /**
     * Local gateway on the default port with a random client id.
     */
    public static ClientConfig defaults() {
        return builder().build();
    }

    public static int randomClientId() {
        return ThreadLocalRandom.current().nextInt(1, 1_000_000);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
            .host(host)
            .port(port)
            .clientId(clientId)
            .connectTimeout(connectTimeout)
            .requestTimeout(requestTimeout)
            .heartbeatInterval(heartbeatInterval)
            .heartbeatTimeout(heartbeatTimeout)
            .reconnectInitialDelay(reconnectInitialDelay)
            .reconnectMaxDelay(reconnectMaxDelay)
            .reconnectMaxAttempts(reconnectMaxAttempts)
            .autoReconnect(autoReconnect)
            .protocolErrorThreshold(protocolErrorThreshold)
            .quoteBufferCapacity(quoteBufferCapacity)
            .metricsPort(metricsPort);
    }

    public static class Builder {
        private String host = DEFAULT_HOST;
        private int port = DEFAULT_PORT;
        private Integer clientId;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration requestTimeout = Duration.ofSeconds(10);
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration heartbeatTimeout = Duration.ofSeconds(90);
        private Duration reconnectInitialDelay = Duration.ofMillis(500);
        private Duration reconnectMaxDelay = Duration.ofSeconds(30);
        private int reconnectMaxAttempts = 10;
        private boolean autoReconnect = true;
        private int protocolErrorThreshold = 10;
        private int quoteBufferCapacity = 100;
        private int metricsPort = 0;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder clientId(int clientId) {
            this.clientId = clientId;
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Builder heartbeatInterval(Duration heartbeatInterval) {
            this.heartbeatInterval = heartbeatInterval;
            return this;
        }

        public Builder heartbeatTimeout(Duration heartbeatTimeout) {
            this.heartbeatTimeout = heartbeatTimeout;
            return this;
        }

        public Builder reconnectInitialDelay(Duration reconnectInitialDelay) {
            this.reconnectInitialDelay = reconnectInitialDelay;
            return this;
        }

        public Builder reconnectMaxDelay(Duration reconnectMaxDelay) {
            this.reconnectMaxDelay = reconnectMaxDelay;
            return this;
        }

        public Builder reconnectMaxAttempts(int reconnectMaxAttempts) {
            this.reconnectMaxAttempts = reconnectMaxAttempts;
            return this;
        }

        public Builder autoReconnect(boolean autoReconnect) {
            this.autoReconnect = autoReconnect;
            return this;
        }

        public Builder protocolErrorThreshold(int protocolErrorThreshold) {
            this.protocolErrorThreshold = protocolErrorThreshold;
            return this;
        }

        public Builder quoteBufferCapacity(int quoteBufferCapacity) {
            this.quoteBufferCapacity = quoteBufferCapacity;
            return this;
        }

        public Builder metricsPort(int metricsPort) {
            this.metricsPort = metricsPort;
            return this;
        }

        public ClientConfig build() {
            int id = clientId != null ? clientId : randomClientId();
            return new ClientConfig(host, port, id, connectTimeout, requestTimeout,
                heartbeatInterval, heartbeatTimeout, reconnectInitialDelay, reconnectMaxDelay,
                reconnectMaxAttempts, autoReconnect, protocolErrorThreshold, quoteBufferCapacity,
                metricsPort);
        }
    }
}
