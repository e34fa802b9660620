package io.twsbridge.domain.event;

import io.twsbridge.domain.market.Bar;

import java.util.List;

/**
 * Complete answer to a historical data request: every bar in one message.
 */
public record HistoricalDataEvent(long requestId, String startTime, String endTime, List<Bar> bars)
    implements InboundEvent {
}
