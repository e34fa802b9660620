package io.twsbridge.infrastructure.connection;

/**
 * Exception thrown when a send is attempted without a live session, and used
 * to fail requests that were in flight when the session dropped.
 */
public class ConnectionLostException extends RuntimeException {

    private final String session;

    public ConnectionLostException(String session, String message) {
        super(String.format("[%s] %s", session, message));
        this.session = session;
    }

    public ConnectionLostException(String session, String message, Throwable cause) {
        super(String.format("[%s] %s", session, message), cause);
        this.session = session;
    }

    public String getSession() {
        return session;
    }
}
