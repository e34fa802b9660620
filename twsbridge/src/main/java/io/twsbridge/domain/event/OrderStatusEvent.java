package io.twsbridge.domain.event;

import io.twsbridge.domain.order.OrderState;

import java.math.BigDecimal;

/**
 * Order status update. Filled quantity and average price are cumulative.
 */
public record OrderStatusEvent(
    long orderId,
    String status,
    BigDecimal filled,
    BigDecimal remaining,
    BigDecimal avgFillPrice,
    long permId,
    long parentId,
    BigDecimal lastFillPrice,
    int clientId,
    String whyHeld
) implements InboundEvent {

    public static final String STATUS_REJECTED = "Rejected";

    @Override
    public long requestId() {
        return orderId;
    }

    /**
     * @return the mapped lifecycle state, or null for statuses with no state
     *         of their own (PendingCancel)
     */
    public OrderState state() {
        return OrderState.fromGatewayStatus(status, filled, remaining);
    }

    public boolean isTerminal() {
        OrderState state = state();
        return state != null && state.isTerminal();
    }

    public boolean isPendingCancel() {
        return "PendingCancel".equals(status);
    }

    /**
     * Status produced locally when the gateway rejects an order through an error message.
     */
    public static OrderStatusEvent rejected(long orderId, String reason) {
        return new OrderStatusEvent(orderId, STATUS_REJECTED, BigDecimal.ZERO, null, null,
            0L, 0L, null, 0, reason);
    }
}
