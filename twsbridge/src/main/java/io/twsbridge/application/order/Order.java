package io.twsbridge.application.order;

import io.twsbridge.domain.event.ExecDetailsEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.order.OrderSnapshot;
import io.twsbridge.domain.order.OrderState;
import io.twsbridge.domain.order.OrderTicket;

import java.math.BigDecimal;
import java.math.MathContext;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Mutable state of one tracked order. Guarded by the manager's lock.
 */
final class Order {

    private OrderTicket ticket;
    private OrderState state = OrderState.CREATED;
    private BigDecimal cumulativeQuantity = BigDecimal.ZERO;
    private BigDecimal averageFillPrice;
    private BigDecimal remainingQuantity;
    private BigDecimal lastFillPrice;
    private long permId;
    private boolean transmitted;
    private boolean cancelPending;
    private String statusMessage;
    private OrderStatusEvent terminalStatus;
    private Instant lastUpdate;
    private final List<Long> childIds = new ArrayList<>();
    private final Map<String, ExecDetailsEvent> fills = new LinkedHashMap<>();

    Order(OrderTicket ticket, Instant created) {
        this.ticket = ticket;
        this.remainingQuantity = ticket.quantity();
        this.lastUpdate = created;
    }

    long id() {
        return ticket.orderId();
    }

    long parentId() {
        return ticket.parentId();
    }

    OrderTicket ticket() {
        return ticket;
    }

    void replaceTicket(OrderTicket ticket, Instant now) {
        this.ticket = ticket;
        if (cumulativeQuantity.signum() == 0) {
            this.remainingQuantity = ticket.quantity();
        }
        this.lastUpdate = now;
    }

    OrderState state() {
        return state;
    }

    boolean isHeld() {
        return state == OrderState.CREATED;
    }

    boolean isTerminal() {
        return state.isTerminal();
    }

    boolean isCancelPending() {
        return cancelPending;
    }

    List<Long> childIds() {
        return childIds;
    }

    void markSubmitted(Instant now) {
        state = OrderState.PENDING_SUBMIT;
        transmitted = true;
        lastUpdate = now;
    }

    void revertToHeld() {
        state = OrderState.CREATED;
        transmitted = false;
    }

    void markCancelPending(Instant now) {
        cancelPending = true;
        lastUpdate = now;
    }

    void clearCancelPending(String reason, Instant now) {
        cancelPending = false;
        statusMessage = reason;
        lastUpdate = now;
    }

    void cancelLocally(String reason, Instant now) {
        state = OrderState.CANCELLED;
        statusMessage = reason;
        terminalStatus = new OrderStatusEvent(id(), "Cancelled", cumulativeQuantity, remainingQuantity,
            averageFillPrice, permId, parentId(), lastFillPrice, 0, reason);
        lastUpdate = now;
    }

    /**
     * @return the status that ended the order, or null while it is live
     */
    OrderStatusEvent terminalStatus() {
        return terminalStatus;
    }

    /**
     * Apply a status if it is progress: a higher rank, or the same rank with a
     * larger filled quantity. Terminal orders never change.
     *
     * @return true if anything changed
     */
    boolean applyStatus(OrderStatusEvent event, OrderState next, Instant now) {
        if (state.isTerminal() || next.rank() < state.rank()) {
            return false;
        }
        BigDecimal filled = event.filled();
        boolean moreFilled = filled != null && filled.compareTo(cumulativeQuantity) > 0;
        if (next.rank() == state.rank() && !moreFilled) {
            return false;
        }

        state = next;
        if (moreFilled) {
            cumulativeQuantity = filled;
            if (isPositive(event.avgFillPrice())) {
                averageFillPrice = event.avgFillPrice();
            }
        }
        if (event.remaining() != null) {
            remainingQuantity = event.remaining();
        }
        if (isPositive(event.lastFillPrice())) {
            lastFillPrice = event.lastFillPrice();
        }
        if (event.permId() > 0) {
            permId = event.permId();
        }
        if (event.whyHeld() != null && !event.whyHeld().isEmpty()) {
            statusMessage = event.whyHeld();
        }
        if (state.isTerminal()) {
            cancelPending = false;
            terminalStatus = event;
        }
        lastUpdate = now;
        return true;
    }

    /**
     * Record a fill. Fills are keyed by execution id, so redelivered
     * executions are ignored; totals only ever grow.
     *
     * @return true if the fill was new
     */
    boolean applyExecution(ExecDetailsEvent fill, Instant now) {
        if (fills.containsKey(fill.execId())) {
            return false;
        }
        fills.put(fill.execId(), fill);

        BigDecimal quantity = BigDecimal.ZERO;
        BigDecimal notional = BigDecimal.ZERO;
        for (ExecDetailsEvent f : fills.values()) {
            if (f.shares() == null || f.price() == null) {
                continue;
            }
            quantity = quantity.add(f.shares());
            notional = notional.add(f.shares().multiply(f.price()));
        }

        if (quantity.compareTo(cumulativeQuantity) > 0) {
            cumulativeQuantity = quantity;
            averageFillPrice = notional.divide(quantity, MathContext.DECIMAL64);
            remainingQuantity = ticket.quantity().subtract(quantity).max(BigDecimal.ZERO);
        }
        if (fill.price() != null) {
            lastFillPrice = fill.price();
        }
        if (fill.permId() > 0) {
            permId = fill.permId();
        }
        lastUpdate = now;
        return true;
    }

    private static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    OrderSnapshot snapshot() {
        return new OrderSnapshot(
            ticket.orderId(),
            ticket.parentId(),
            ticket,
            state,
            cumulativeQuantity,
            averageFillPrice,
            remainingQuantity,
            lastFillPrice,
            permId,
            transmitted,
            cancelPending,
            List.copyOf(childIds),
            statusMessage,
            lastUpdate);
    }
}
