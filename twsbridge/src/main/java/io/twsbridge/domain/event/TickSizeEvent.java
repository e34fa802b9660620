package io.twsbridge.domain.event;

import java.math.BigDecimal;

public record TickSizeEvent(long requestId, int tickType, BigDecimal size) implements InboundEvent {
}
