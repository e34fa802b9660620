package io.twsbridge.domain.event;

/**
 * Time of the last account update, "HH:mm" in the gateway's time zone.
 */
public record AccountUpdateTimeEvent(String time) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
