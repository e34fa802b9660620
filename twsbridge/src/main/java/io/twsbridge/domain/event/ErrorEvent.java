package io.twsbridge.domain.event;

/**
 * Error or notice from the gateway. The id is a request id, an order id, or -1.
 */
public record ErrorEvent(long id, int code, String message) implements InboundEvent {

    /** Order rejected by the gateway or exchange. */
    public static final int ORDER_REJECTED = 201;

    /** Order cancelled; the status message carries the outcome. */
    public static final int ORDER_CANCELLED = 202;

    @Override
    public long requestId() {
        return id;
    }

    /**
     * Informational codes never fail a request: farm status notices (2100-2199),
     * order warnings (399), the delayed-data notice (10167) and the cancel
     * confirmation (202).
     */
    public boolean isWarning() {
        return (code >= 2100 && code < 2200) || code == 399 || code == 10167 || code == ORDER_CANCELLED;
    }
}
