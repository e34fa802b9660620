package io.twsbridge.domain.event;

import io.twsbridge.domain.market.RealTimeBar;

public record RealTimeBarEvent(long requestId, RealTimeBar bar) implements InboundEvent {
}
