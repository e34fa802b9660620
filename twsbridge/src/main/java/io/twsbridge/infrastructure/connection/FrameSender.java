package io.twsbridge.infrastructure.connection;

import io.twsbridge.infrastructure.wire.ProtocolVersion;

/**
 * Writes one encoded frame to the live session.
 */
@FunctionalInterface
public interface FrameSender {

    /**
     * @throws ConnectionLostException if no session is up or the write fails
     */
    void send(byte[] frame);

    /**
     * Server version whose layouts frames for this sender must use.
     */
    default int serverVersion() {
        return ProtocolVersion.MAX_CLIENT_VERSION;
    }
}
