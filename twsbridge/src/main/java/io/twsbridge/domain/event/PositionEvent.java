package io.twsbridge.domain.event;

import io.twsbridge.domain.contract.Contract;

import java.math.BigDecimal;

/**
 * Portfolio position for one account and contract.
 */
public record PositionEvent(
    String account,
    Contract contract,
    BigDecimal position,
    BigDecimal averageCost
) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
