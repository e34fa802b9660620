package io.twsbridge.infrastructure.connection;

/**
 * Session lifecycle callbacks. Invoked on internal threads; implementations
 * must not block.
 */
public interface ConnectionListener {

    default void onConnected(ConnectionInfo info) {
    }

    /**
     * The session dropped. Responses to requests in flight will never arrive.
     */
    default void onConnectionLost(String reason) {
    }

    default void onReconnected(ConnectionInfo info) {
    }

    /**
     * Reconnection gave up; the manager is DISCONNECTED.
     */
    default void onReconnectFailed(int attempts) {
    }

    default void onDisconnected() {
    }
}
