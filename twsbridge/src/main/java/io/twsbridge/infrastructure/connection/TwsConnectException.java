package io.twsbridge.infrastructure.connection;

/**
 * Exception thrown when a session cannot be established.
 */
public class TwsConnectException extends RuntimeException {

    public enum Reason {
        /** Nothing listening, connection reset or closed during the handshake. */
        REFUSED,
        /** Connect or handshake did not complete in time. */
        TIMEOUT,
        /** Server version outside the supported range. */
        VERSION_MISMATCH
    }

    private final String session;
    private final Reason reason;

    public TwsConnectException(String session, Reason reason, String message) {
        super(String.format("[%s] %s: %s", session, reason, message));
        this.session = session;
        this.reason = reason;
    }

    public TwsConnectException(String session, Reason reason, String message, Throwable cause) {
        super(String.format("[%s] %s: %s", session, reason, message), cause);
        this.session = session;
        this.reason = reason;
    }

    public String getSession() {
        return session;
    }

    public Reason getReason() {
        return reason;
    }
}
