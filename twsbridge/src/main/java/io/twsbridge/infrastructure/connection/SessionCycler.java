package io.twsbridge.infrastructure.connection;

/**
 * Closes and re-opens the gateway session, replaying subscriptions.
 */
@FunctionalInterface
public interface SessionCycler {

    void cycle();
}
