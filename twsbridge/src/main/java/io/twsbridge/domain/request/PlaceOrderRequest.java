package io.twsbridge.domain.request;

import io.twsbridge.domain.order.OrderTicket;

/**
 * Place a new order, or modify a live one when the order id is already known to the gateway.
 */
public record PlaceOrderRequest(OrderTicket ticket) implements ClientRequest {

    public PlaceOrderRequest {
        if (ticket == null) {
            throw new IllegalArgumentException("Order ticket cannot be null");
        }
        if (ticket.orderId() <= 0) {
            throw new IllegalArgumentException("Order id must be assigned before placement");
        }
    }

    @Override
    public long requestId() {
        return ticket.orderId();
    }
}
