package io.twsbridge.domain.event;

public record PositionEndEvent() implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
