package io.twsbridge.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.twsbridge.util.Env;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;

/**
 * Builds a {@link ClientConfig} from an optional JSON file plus environment overrides.
 *
 * Precedence: environment / system property, then file, then defaults.
 * The file path comes from {@code TWS_CONFIG}. A missing or unreadable file
 * falls back to defaults; a file with invalid values fails fast.
 *
 * Example file:
 * <pre>
 * {
 *   "host": "127.0.0.1",
 *   "port": 7497,
 *   "clientId": 12,
 *   "requestTimeoutMs": 5000,
 *   "metricsPort": 9464
 * }
 * </pre>
 */
public final class ClientConfigLoader {
    private static final Logger log = LoggerFactory.getLogger(ClientConfigLoader.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static final String CONFIG_PATH_VAR = "TWS_CONFIG";

    private ClientConfigLoader() {}

    public static ClientConfig load() {
        String path = Env.get(CONFIG_PATH_VAR, null);
        return load(path != null ? Paths.get(path) : null);
    }

    public static ClientConfig load(Path configFile) {
        ClientConfig.Builder builder = ClientConfig.builder();
        if (configFile != null) {
            applyFile(builder, configFile);
        }
        applyEnvironment(builder);
        return builder.build();
    }

    private static void applyFile(ClientConfig.Builder builder, Path configFile) {
        if (!Files.exists(configFile)) {
            log.info("[ClientConfigLoader] No config file at {}, using defaults", configFile);
            return;
        }
        JsonNode root;
        try {
            root = MAPPER.readTree(Files.readString(configFile));
        } catch (IOException e) {
            log.error("[ClientConfigLoader] Failed to read {}, using defaults: {}", configFile, e.getMessage());
            return;
        }
        if (root == null || !root.isObject()) {
            log.error("[ClientConfigLoader] {} is not a JSON object, using defaults", configFile);
            return;
        }
        apply(builder, root);
        log.info("[ClientConfigLoader] Loaded client config from {}", configFile);
    }

    static void apply(ClientConfig.Builder builder, JsonNode root) {
        if (root.hasNonNull("host")) builder.host(root.get("host").asText());
        if (root.hasNonNull("port")) builder.port(root.get("port").asInt());
        if (root.hasNonNull("clientId")) builder.clientId(root.get("clientId").asInt());
        if (root.hasNonNull("connectTimeoutMs")) builder.connectTimeout(millis(root, "connectTimeoutMs"));
        if (root.hasNonNull("requestTimeoutMs")) builder.requestTimeout(millis(root, "requestTimeoutMs"));
        if (root.hasNonNull("heartbeatIntervalMs")) builder.heartbeatInterval(millis(root, "heartbeatIntervalMs"));
        if (root.hasNonNull("heartbeatTimeoutMs")) builder.heartbeatTimeout(millis(root, "heartbeatTimeoutMs"));
        if (root.hasNonNull("reconnectInitialDelayMs")) builder.reconnectInitialDelay(millis(root, "reconnectInitialDelayMs"));
        if (root.hasNonNull("reconnectMaxDelayMs")) builder.reconnectMaxDelay(millis(root, "reconnectMaxDelayMs"));
        if (root.hasNonNull("reconnectMaxAttempts")) builder.reconnectMaxAttempts(root.get("reconnectMaxAttempts").asInt());
        if (root.hasNonNull("autoReconnect")) builder.autoReconnect(root.get("autoReconnect").asBoolean());
        if (root.hasNonNull("protocolErrorThreshold")) builder.protocolErrorThreshold(root.get("protocolErrorThreshold").asInt());
        if (root.hasNonNull("quoteBufferCapacity")) builder.quoteBufferCapacity(root.get("quoteBufferCapacity").asInt());
        if (root.hasNonNull("metricsPort")) builder.metricsPort(root.get("metricsPort").asInt());
    }

    private static Duration millis(JsonNode root, String field) {
        return Duration.ofMillis(root.get(field).asLong());
    }

    private static void applyEnvironment(ClientConfig.Builder builder) {
        String host = Env.get("TWS_HOST", null);
        if (host != null) builder.host(host);

        int port = Env.getInt("TWS_PORT", -1);
        if (port > 0) builder.port(port);

        String clientId = Env.get("TWS_CLIENT_ID", null);
        if (clientId != null) {
            try {
                builder.clientId(Integer.parseInt(clientId.trim()));
            } catch (NumberFormatException e) {
                log.warn("[ClientConfigLoader] Ignoring non-numeric TWS_CLIENT_ID: {}", clientId);
            }
        }

        long connectMs = Env.getLong("TWS_CONNECT_TIMEOUT_MS", -1);
        if (connectMs > 0) builder.connectTimeout(Duration.ofMillis(connectMs));

        long requestMs = Env.getLong("TWS_REQUEST_TIMEOUT_MS", -1);
        if (requestMs > 0) builder.requestTimeout(Duration.ofMillis(requestMs));

        long heartbeatMs = Env.getLong("TWS_HEARTBEAT_INTERVAL_MS", -1);
        if (heartbeatMs > 0) builder.heartbeatInterval(Duration.ofMillis(heartbeatMs));

        long heartbeatTimeoutMs = Env.getLong("TWS_HEARTBEAT_TIMEOUT_MS", -1);
        if (heartbeatTimeoutMs > 0) builder.heartbeatTimeout(Duration.ofMillis(heartbeatTimeoutMs));

        int maxAttempts = Env.getInt("TWS_RECONNECT_MAX_ATTEMPTS", -1);
        if (maxAttempts > 0) builder.reconnectMaxAttempts(maxAttempts);

        String autoReconnect = Env.get("TWS_AUTO_RECONNECT", null);
        if (autoReconnect != null) builder.autoReconnect(Env.getBool("TWS_AUTO_RECONNECT", true));

        int metricsPort = Env.getInt("TWS_METRICS_PORT", -1);
        if (metricsPort >= 0) builder.metricsPort(metricsPort);
    }
}
