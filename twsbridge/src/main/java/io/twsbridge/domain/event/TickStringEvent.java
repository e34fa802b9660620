package io.twsbridge.domain.event;

/**
 * String tick. The last-trade timestamp arrives this way as epoch seconds.
 */
public record TickStringEvent(long requestId, int tickType, String value) implements InboundEvent {
}
