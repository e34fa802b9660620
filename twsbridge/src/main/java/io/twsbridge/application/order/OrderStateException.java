package io.twsbridge.application.order;

import io.twsbridge.domain.order.OrderState;

/**
 * Exception thrown when an operation is not valid in the order's current state.
 */
public class OrderStateException extends RuntimeException {

    private final long orderId;
    private final OrderState state;

    public OrderStateException(long orderId, OrderState state, String message) {
        super(String.format("[%d:%s] %s", orderId, state, message));
        this.orderId = orderId;
        this.state = state;
    }

    public long getOrderId() {
        return orderId;
    }

    public OrderState getState() {
        return state;
    }
}
