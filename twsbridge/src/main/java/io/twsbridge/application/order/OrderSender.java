package io.twsbridge.application.order;

import io.twsbridge.domain.request.CancelOrderRequest;
import io.twsbridge.domain.request.PlaceOrderRequest;

/**
 * Outbound side of the order manager.
 */
public interface OrderSender {

    /**
     * Send a placement (or a modification when the id is already live) and
     * register a waiter for its terminal status.
     */
    void place(PlaceOrderRequest request);

    void cancel(CancelOrderRequest request);
}
