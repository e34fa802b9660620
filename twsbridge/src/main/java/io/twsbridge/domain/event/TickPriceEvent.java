package io.twsbridge.domain.event;

import java.math.BigDecimal;

/**
 * Price tick; size is set for bid, ask and last ticks.
 */
public record TickPriceEvent(
    long requestId,
    int tickType,
    BigDecimal price,
    BigDecimal size,
    int attributeMask
) implements InboundEvent {
}
