package io.twsbridge.domain.order;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

/**
 * Point-in-time copy of a tracked order.
 */
public record OrderSnapshot(
    long orderId,
    long parentId,
    OrderTicket ticket,
    OrderState state,
    BigDecimal cumulativeQuantity,
    BigDecimal averageFillPrice,
    BigDecimal remainingQuantity,
    BigDecimal lastFillPrice,
    long permId,
    boolean transmitted,
    boolean cancelPending,
    List<Long> childIds,
    String statusMessage,
    Instant lastUpdate
) {
    public boolean isTerminal() {
        return state.isTerminal();
    }
}
