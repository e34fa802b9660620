package io.twsbridge.infrastructure.connection;

import java.time.Instant;

/**
 * Facts learned during the handshake of one session.
 *
 * @param serverVersion negotiated protocol version
 * @param connectionTime gateway's own connection timestamp, verbatim
 * @param nextValidId first order id the gateway accepts
 */
public record ConnectionInfo(
    String host,
    int port,
    int clientId,
    int serverVersion,
    String connectionTime,
    long nextValidId,
    Instant connectedAt
) {
    public String sessionLabel() {
        return sessionLabel(host, port, clientId);
    }

    static String sessionLabel(String host, int port, int clientId) {
        return host + ":" + port + "/" + clientId;
    }
}
