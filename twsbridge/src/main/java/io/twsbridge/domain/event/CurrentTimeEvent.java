package io.twsbridge.domain.event;

import java.time.Instant;

public record CurrentTimeEvent(long epochSeconds) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }

    public Instant time() {
        return Instant.ofEpochSecond(epochSeconds);
    }
}
