package io.twsbridge.domain.event;

import io.twsbridge.domain.contract.Contract;

import java.math.BigDecimal;

/**
 * One execution (fill). requestId is -1 for fills pushed without a request.
 *
 * @param exchange    execution venue, which may differ from the contract's routing exchange
 * @param liquidation 1 when the fill came from an IB-initiated liquidation
 */
public record ExecDetailsEvent(
    long requestId,
    long orderId,
    Contract contract,
    String execId,
    String time,
    String account,
    String exchange,
    String side,
    BigDecimal shares,
    BigDecimal price,
    long permId,
    int clientId,
    int liquidation,
    BigDecimal cumulativeQuantity,
    BigDecimal averagePrice,
    String orderRef
) implements InboundEvent {
}
