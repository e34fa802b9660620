package io.twsbridge.application.order;

import io.twsbridge.application.correlation.RequestIdGenerator;
import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.ExecDetailsEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.order.BracketSpec;
import io.twsbridge.domain.order.OcaType;
import io.twsbridge.domain.order.OrderAction;
import io.twsbridge.domain.order.OrderSnapshot;
import io.twsbridge.domain.order.OrderState;
import io.twsbridge.domain.order.OrderTicket;
import io.twsbridge.domain.order.OrderType;
import io.twsbridge.domain.request.CancelOrderRequest;
import io.twsbridge.domain.request.PlaceOrderRequest;
import io.twsbridge.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tracks every order placed through this client.
 *
 * State only moves forward: {@link #apply(InboundEvent)} is the sole mutator of
 * gateway-driven state and ignores duplicates and regressions. Caller
 * operations (submit, transmit, amend, cancel) change local bookkeeping and
 * send frames; frames are written outside the lock.
 *
 * Id reuse: submitting a ticket whose order id is already tracked amends a held
 * order in place, re-sends a live order as a modification, and fails for a
 * terminal order.
 *
 * Errors reject an order only when the gateway says so: code 201 at any time,
 * or one of the submission failures in {@link #SUBMISSION_REJECTIONS} before the
 * first status arrives. Anything else (a refused cancel, an unknown id on
 * cancel) leaves the order as it is.
 */
public class OrderLifecycleManager {
    private static final Logger log = LoggerFactory.getLogger(OrderLifecycleManager.class);

    /**
     * Error codes that mean a just-sent order never became live: duplicate id (103),
     * incomplete order (107), price off tick (110), no security definition (200),
     * rejected (201), security not allowed for the account (203), validation
     * failure (321), size off market rule (355) and size limits (382, 383).
     */
    static final Set<Integer> SUBMISSION_REJECTIONS = Set.of(103, 107, 110, 200, 201, 203, 321, 355, 382, 383);

    private final OrderSender sender;
    private final RequestIdGenerator ids;
    private final Clock clock;

    private final Object lock = new Object();
    private final Map<Long, Order> orders = new LinkedHashMap<>();

    private volatile ClientMetrics metrics;

    public OrderLifecycleManager(OrderSender sender, RequestIdGenerator ids) {
        this(sender, ids, Clock.systemUTC());
    }

    public OrderLifecycleManager(OrderSender sender, RequestIdGenerator ids, Clock clock) {
        this.sender = sender;
        this.ids = ids;
        this.clock = clock;
    }

    public void setMetrics(ClientMetrics metrics) {
        this.metrics = metrics;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CALLER OPERATIONS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Track and (unless held) send an order. A bracket ticket creates a parent
     * and two OCA children that are released together.
     *
     * @param hold keep the order local until {@link #transmit(long)}
     * @return the order id (the parent's for a bracket)
     * @throws OrderStateException if the ticket reuses the id of a terminal order
     */
    public long submit(OrderTicket ticket, boolean hold) {
        if (ticket == null) {
            throw new IllegalArgumentException("Order ticket cannot be null");
        }

        long requestedId = ticket.orderId();
        if (requestedId > 0) {
            boolean known;
            boolean held;
            synchronized (lock) {
                Order existing = orders.get(requestedId);
                known = existing != null;
                held = known && existing.isHeld();
            }
            if (known) {
                amend(requestedId, ticket);
                if (held && !hold) {
                    transmit(requestedId);
                }
                return requestedId;
            }
            ids.advanceTo(requestedId + 1);
        }

        long orderId = requestedId > 0 ? requestedId : ids.next();
        List<OrderTicket> family = ticket.hasBracket()
            ? bracketFamily(ticket, orderId)
            : List.of(ticket.toBuilder().orderId(orderId).bracket(null).build());

        List<Order> toSend = new ArrayList<>();
        synchronized (lock) {
            Order parent = null;
            for (OrderTicket member : family) {
                Order order = new Order(member, clock.instant());
                orders.put(member.orderId(), order);
                if (parent == null) {
                    parent = order;
                } else {
                    parent.childIds().add(member.orderId());
                }
                if (!hold) {
                    order.markSubmitted(clock.instant());
                    toSend.add(order);
                }
            }
        }

        log.info("[OrderManager] {} order {} {} {} {} x {}{}",
            hold ? "Holding" : "Submitting", orderId, ticket.action(), ticket.contract().displayName(),
            ticket.orderType().wireCode(), ticket.quantity(),
            ticket.hasBracket() ? " (bracket)" : "");

        if (!toSend.isEmpty()) {
            sendPlacements(toSend, true);
        }
        return orderId;
    }

    /**
     * Send a held order together with its held children.
     */
    public void transmit(long orderId) {
        List<Order> toSend = new ArrayList<>();
        synchronized (lock) {
            Order order = require(orderId);
            if (!order.isHeld()) {
                throw new OrderStateException(orderId, order.state(), "Only held orders can be transmitted");
            }
            order.markSubmitted(clock.instant());
            toSend.add(order);
            for (Long childId : order.childIds()) {
                Order child = orders.get(childId);
                if (child != null && child.isHeld()) {
                    child.markSubmitted(clock.instant());
                    toSend.add(child);
                }
            }
        }
        log.info("[OrderManager] Transmitting held order {} ({} frame(s))", orderId, toSend.size());
        sendPlacements(toSend, false);
    }

    /**
     * Replace the fields of an order. Held orders change locally; live orders
     * are re-sent under the same id as a modification. Identity fields (id,
     * parent, OCA group, transmit flag) are kept.
     */
    public void amend(long orderId, OrderTicket ticket) {
        if (ticket == null) {
            throw new IllegalArgumentException("Order ticket cannot be null");
        }
        OrderTicket merged;
        boolean live;
        synchronized (lock) {
            Order order = require(orderId);
            if (order.isTerminal()) {
                throw new OrderStateException(orderId, order.state(), "Cannot amend a terminal order");
            }
            if (order.isCancelPending()) {
                throw new OrderStateException(orderId, order.state(), "Cannot amend an order with a pending cancel");
            }
            OrderTicket current = order.ticket();
            merged = ticket.toBuilder()
                .orderId(orderId)
                .parentId(current.parentId())
                .ocaGroup(current.ocaGroup())
                .ocaType(current.ocaType())
                .transmit(order.isHeld() ? current.transmit() : true)
                .bracket(null)
                .build();
            live = !order.isHeld();
            if (!live) {
                order.replaceTicket(merged, clock.instant());
            }
        }

        if (!live) {
            log.info("[OrderManager] Amended held order {}", orderId);
            return;
        }

        log.info("[OrderManager] Modifying live order {}: {} {} @ {}",
            orderId, merged.orderType().wireCode(), merged.quantity(), merged.limitPrice());
        sender.place(new PlaceOrderRequest(merged));
        synchronized (lock) {
            Order order = orders.get(orderId);
            if (order != null && !order.isTerminal()) {
                order.replaceTicket(merged, clock.instant());
            }
        }
    }

    /**
     * Cancel an order. Held orders and held children are dropped locally without
     * any frame; live orders get a cancel request and stay non-terminal until the
     * gateway confirms.
     *
     * @throws OrderStateException if the order is already terminal
     */
    public void cancel(long orderId) {
        boolean live;
        synchronized (lock) {
            Order order = require(orderId);
            if (order.isTerminal()) {
                throw new OrderStateException(orderId, order.state(), "Cannot cancel a terminal order");
            }
            int removed = removeHeldChildren(order);
            live = !order.isHeld();
            if (live) {
                order.markCancelPending(clock.instant());
            } else {
                order.cancelLocally("Cancelled before transmission", clock.instant());
            }
            if (removed > 0) {
                log.info("[OrderManager] Dropped {} untransmitted child order(s) of {}", removed, orderId);
            }
        }

        if (live) {
            log.info("[OrderManager] Cancelling live order {}", orderId);
            sender.cancel(new CancelOrderRequest(orderId));
        } else {
            log.info("[OrderManager] Cancelled held order {} locally", orderId);
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Apply an inbound event to order state.
     *
     * @return synthetic events derived from it (a REJECTED status for an order
     *         error); they must be dispatched like gateway events
     */
    public List<InboundEvent> apply(InboundEvent event) {
        if (event instanceof OrderStatusEvent) {
            applyStatus((OrderStatusEvent) event);
            return List.of();
        }
        if (event instanceof ExecDetailsEvent) {
            applyExecution((ExecDetailsEvent) event);
            return List.of();
        }
        if (event instanceof ErrorEvent) {
            return applyError((ErrorEvent) event);
        }
        return List.of();
    }

    private void applyStatus(OrderStatusEvent event) {
        List<Long> siblingsToCancel;
        OrderState newState;
        synchronized (lock) {
            Order order = orders.get(event.orderId());
            if (order == null) {
                log.debug("[OrderManager] Status for untracked order {}: {}", event.orderId(), event.status());
                return;
            }

            OrderState next = event.state();
            if (next == null) {
                if (event.isPendingCancel() && !order.isTerminal()) {
                    order.markCancelPending(clock.instant());
                }
                return;
            }

            if (!order.applyStatus(event, next, clock.instant())) {
                log.debug("[OrderManager] Ignoring stale status {} for order {} (state={})",
                    event.status(), event.orderId(), order.state());
                return;
            }
            newState = order.state();
            siblingsToCancel = (newState == OrderState.FILLED || newState == OrderState.CANCELLED)
                ? claimSiblings(order)
                : List.of();
        }

        log.info("[OrderManager] Order {} -> {} (filled={}, avg={})",
            event.orderId(), newState, event.filled(), event.avgFillPrice());
        if (metrics != null) {
            metrics.recordOrderStatus(newState.name());
        }
        cancelSiblings(event.orderId(), siblingsToCancel);
    }

    private void applyExecution(ExecDetailsEvent event) {
        if (event.orderId() <= 0) {
            return;
        }
        synchronized (lock) {
            Order order = orders.get(event.orderId());
            if (order == null) {
                return;
            }
            if (order.applyExecution(event, clock.instant())) {
                log.debug("[OrderManager] Fill {} for order {}: {} @ {}",
                    event.execId(), event.orderId(), event.shares(), event.price());
            }
        }
    }

    private List<InboundEvent> applyError(ErrorEvent error) {
        OrderStatusEvent rejection;
        synchronized (lock) {
            Order order = orders.get(error.id());
            if (order == null || order.isTerminal() || error.isWarning()) {
                return List.of();
            }
            boolean rejected = error.code() == ErrorEvent.ORDER_REJECTED
                || (order.state() == OrderState.PENDING_SUBMIT && SUBMISSION_REJECTIONS.contains(error.code()));
            if (!rejected) {
                if (order.isCancelPending()) {
                    // the cancel itself was refused; the order stays live
                    order.clearCancelPending(error.message(), clock.instant());
                }
                log.warn("[OrderManager] Gateway error {} for order {}: {}", error.code(), error.id(), error.message());
                return List.of();
            }
            rejection = OrderStatusEvent.rejected(error.id(), error.message());
        }

        log.warn("[OrderManager] Order {} rejected ({}): {}", error.id(), error.code(), error.message());
        applyStatus(rejection);
        return List.of(rejection);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public Optional<OrderSnapshot> find(long orderId) {
        synchronized (lock) {
            Order order = orders.get(orderId);
            return order == null ? Optional.empty() : Optional.of(order.snapshot());
        }
    }

    /**
     * @return the status that ended the order (gateway or local cancel), empty while it is live or unknown
     */
    public Optional<OrderStatusEvent> terminalStatus(long orderId) {
        synchronized (lock) {
            Order order = orders.get(orderId);
            return order == null ? Optional.empty() : Optional.ofNullable(order.terminalStatus());
        }
    }

    /**
     * @return non-terminal orders in submission order
     */
    public List<OrderSnapshot> liveOrders() {
        synchronized (lock) {
            return orders.values().stream()
                .filter(order -> !order.isTerminal())
                .map(Order::snapshot)
                .collect(Collectors.toList());
        }
    }

    public List<OrderSnapshot> allOrders() {
        synchronized (lock) {
            return orders.values().stream()
                .map(Order::snapshot)
                .collect(Collectors.toList());
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Parent plus lower and upper children on the opposite side, sharing one
     * OCA group. Only the last child carries transmit=true so the gateway
     * releases the three together.
     */
    private List<OrderTicket> bracketFamily(OrderTicket ticket, long parentId) {
        BracketSpec bracket = ticket.bracket();
        BigDecimal base = ticket.limitPrice();
        if (base == null) {
            throw new IllegalArgumentException("Bracket orders need a limit price to derive child prices");
        }
        OrderAction childSide = ticket.action().opposite();
        String ocaGroup = ticket.ocaGroup() != null && !ticket.ocaGroup().isBlank()
            ? ticket.ocaGroup()
            : "OCA-" + parentId;

        OrderTicket parent = ticket.toBuilder()
            .orderId(parentId)
            .bracket(null)
            .ocaGroup(null)
            .transmit(false)
            .build();
        OrderTicket lower = childTicket(ticket, ids.next(), parentId, childSide,
            bracket.lowerTypeFor(ticket.action()), base.subtract(bracket.lowerDelta()), ocaGroup, false);
        OrderTicket upper = childTicket(ticket, ids.next(), parentId, childSide,
            bracket.upperTypeFor(ticket.action()), base.add(bracket.upperDelta()), ocaGroup, true);
        return List.of(parent, lower, upper);
    }

    private static OrderTicket childTicket(OrderTicket parent, long orderId, long parentId, OrderAction side,
                                           OrderType type, BigDecimal price, String ocaGroup, boolean transmit) {
        OrderTicket.Builder builder = OrderTicket.builder(parent.contract(), side, parent.quantity())
            .orderId(orderId)
            .parentId(parentId)
            .orderType(type)
            .timeInForce(parent.timeInForce())
            .account(parent.account())
            .outsideRth(parent.outsideRth())
            .ocaGroup(ocaGroup)
            .ocaType(OcaType.CANCEL_WITH_BLOCK)
            .transmit(transmit);
        if (type.requiresLimitPrice()) {
            builder.limitPrice(price);
        }
        if (type.requiresAuxPrice()) {
            builder.auxPrice(price);
        }
        return builder.build();
    }

    private void sendPlacements(List<Order> toSend, boolean dropOnFailure) {
        for (int i = 0; i < toSend.size(); i++) {
            Order order = toSend.get(i);
            try {
                sender.place(new PlaceOrderRequest(order.ticket()));
            } catch (RuntimeException e) {
                List<Order> unsent = toSend.subList(i, toSend.size());
                synchronized (lock) {
                    for (Order failed : unsent) {
                        if (dropOnFailure) {
                            orders.remove(failed.id());
                            Order parent = orders.get(failed.parentId());
                            if (parent != null) {
                                parent.childIds().remove(Long.valueOf(failed.id()));
                            }
                        } else {
                            failed.revertToHeld();
                        }
                    }
                }
                log.error("[OrderManager] Failed to send order {}: {}", order.id(), e.getMessage());
                throw e;
            }
        }
    }

    /**
     * Mark the non-terminal OCA siblings of a child for cancellation.
     * Held siblings are cancelled locally; live ones are returned for a cancel frame.
     */
    private List<Long> claimSiblings(Order child) {
        if (child.parentId() == 0 || child.ticket().ocaGroup() == null) {
            return List.of();
        }
        List<Long> live = new ArrayList<>();
        for (Order sibling : orders.values()) {
            if (sibling == child
                || sibling.parentId() != child.parentId()
                || !child.ticket().ocaGroup().equals(sibling.ticket().ocaGroup())
                || sibling.isTerminal()
                || sibling.isCancelPending()) {
                continue;
            }
            if (sibling.isHeld()) {
                sibling.cancelLocally("OCA sibling " + child.id() + " completed", clock.instant());
            } else {
                sibling.markCancelPending(clock.instant());
                live.add(sibling.id());
            }
        }
        return live;
    }

    private void cancelSiblings(long childId, List<Long> siblings) {
        for (Long siblingId : siblings) {
            log.info("[OrderManager] Cancelling OCA sibling {} of order {}", siblingId, childId);
            try {
                sender.cancel(new CancelOrderRequest(siblingId));
            } catch (RuntimeException e) {
                log.error("[OrderManager] Failed to cancel OCA sibling {}: {}", siblingId, e.getMessage());
            }
        }
    }

    private int removeHeldChildren(Order order) {
        int removed = 0;
        for (Long childId : new ArrayList<>(order.childIds())) {
            Order child = orders.get(childId);
            if (child != null && child.isHeld()) {
                orders.remove(childId);
                order.childIds().remove(childId);
                removed++;
            }
        }
        return removed;
    }

    private Order require(long orderId) {
        Order order = orders.get(orderId);
        if (order == null) {
            throw new IllegalArgumentException("Unknown order id " + orderId);
        }
        return order;
    }
}
