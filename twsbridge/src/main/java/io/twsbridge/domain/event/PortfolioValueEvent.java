package io.twsbridge.domain.event;

import io.twsbridge.domain.contract.Contract;

import java.math.BigDecimal;

/**
 * Marked-to-market position from an account updates subscription.
 */
public record PortfolioValueEvent(
    Contract contract,
    BigDecimal position,
    BigDecimal marketPrice,
    BigDecimal marketValue,
    BigDecimal averageCost,
    BigDecimal unrealizedPnl,
    BigDecimal realizedPnl,
    String account
) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
