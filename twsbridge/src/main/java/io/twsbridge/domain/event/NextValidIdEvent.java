package io.twsbridge.domain.event;

/**
 * Lowest order id the gateway will accept from this client.
 */
public record NextValidIdEvent(long orderId) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
