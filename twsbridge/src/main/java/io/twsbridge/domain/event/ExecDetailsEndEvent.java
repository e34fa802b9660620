package io.twsbridge.domain.event;

public record ExecDetailsEndEvent(long requestId) implements InboundEvent {
}
