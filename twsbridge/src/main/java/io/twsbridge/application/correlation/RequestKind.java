package io.twsbridge.application.correlation;

public enum RequestKind {
    /** Resolved by exactly one terminal event. */
    ONESHOT,
    /** Every event goes to a sink until cancelled. */
    STREAMING
}
