package io.twsbridge.domain.event;

public record ContractDetailsEndEvent(long requestId) implements InboundEvent {
}
