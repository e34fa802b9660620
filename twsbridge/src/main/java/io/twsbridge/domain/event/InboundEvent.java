package io.twsbridge.domain.event;

/**
 * A decoded message from the gateway.
 *
 * Messages that carry no request id on the wire (current time, open orders,
 * positions, account lists) report {@link #NO_REQUEST_ID}.
 */
public interface InboundEvent {

    long NO_REQUEST_ID = -1L;

    /**
     * Request (or order) id this event answers, or {@link #NO_REQUEST_ID}.
     */
    long requestId();
}
