package io.twsbridge.domain.event;

import io.twsbridge.domain.contract.Contract;

import java.math.BigDecimal;

/**
 * Open order description, sent after a placement and in reply to an open orders request.
 *
 * Carries the order's identity and terms only. The order's status arrives in the
 * {@link OrderStatusEvent} the gateway sends alongside.
 */
public record OpenOrderEvent(
    long orderId,
    Contract contract,
    String action,
    BigDecimal quantity,
    String orderType,
    BigDecimal limitPrice,
    BigDecimal auxPrice,
    String timeInForce,
    String ocaGroup,
    String account,
    String orderRef,
    int clientId,
    long permId,
    boolean outsideRth,
    int ocaType,
    long parentId
) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
