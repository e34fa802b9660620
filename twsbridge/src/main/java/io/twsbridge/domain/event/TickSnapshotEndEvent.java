package io.twsbridge.domain.event;

public record TickSnapshotEndEvent(long requestId) implements InboundEvent {
}
