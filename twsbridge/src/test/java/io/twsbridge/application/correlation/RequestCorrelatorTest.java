package io.twsbridge.application.correlation;

import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.event.CurrentTimeEvent;
import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.ExecDetailsEndEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.OpenOrderEndEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.event.TickPriceEvent;
import io.twsbridge.domain.event.TickSizeEvent;
import io.twsbridge.domain.event.TickSnapshotEndEvent;
import io.twsbridge.domain.order.OrderAction;
import io.twsbridge.domain.order.OrderTicket;
import io.twsbridge.domain.request.CurrentTimeRequest;
import io.twsbridge.domain.request.ExecutionFilter;
import io.twsbridge.domain.request.ExecutionsRequest;
import io.twsbridge.domain.request.MarketDataRequest;
import io.twsbridge.domain.request.OpenOrdersRequest;
import io.twsbridge.domain.request.PlaceOrderRequest;
import io.twsbridge.infrastructure.connection.ConnectionLostException;
import io.twsbridge.infrastructure.wire.EncodingException;
import io.twsbridge.infrastructure.wire.RequestEncoder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RequestCorrelator.
 *
 * Tests:
 * - Oneshot requests resolve exactly once
 * - Timeouts remove the registration and late replies are dropped
 * - Id-less replies are matched first-in first-out
 * - Gateway errors and lost sessions fail waiters
 * - Streaming sinks see events in order
 * - Waiters re-armed after a lost session
 */
class RequestCorrelatorTest {

    private static final Contract GOOG = Contract.stock("GOOG");
    private static final Duration WAIT = Duration.ofSeconds(2);

    private List<byte[]> sent;
    private RequestIdGenerator ids;
    private RequestCorrelator correlator;

    @BeforeEach
    void setUp() {
        sent = new CopyOnWriteArrayList<>();
        ids = new RequestIdGenerator(100);
        correlator = new RequestCorrelator(sent::add, new RequestEncoder(), ids);
    }

    private long submitSnapshot() {
        return correlator.submit(RequestType.SNAPSHOT, id -> new MarketDataRequest(id, GOOG, "", true));
    }

    private static OrderStatusEvent status(long orderId, String status, String filled, String remaining) {
        return new OrderStatusEvent(orderId, status, new BigDecimal(filled), new BigDecimal(remaining),
            BigDecimal.ZERO, 0L, 0L, BigDecimal.ZERO, 0, "");
    }

    @Test
    void testSnapshotCollectsIntermediates() {
        long id = submitSnapshot();
        assertEquals(100, id);
        assertEquals(1, sent.size(), "Request frame written");

        TickPriceEvent bid = new TickPriceEvent(id, 1, new BigDecimal("599"), new BigDecimal("3"), 0);
        TickSizeEvent volume = new TickSizeEvent(id, 8, new BigDecimal("1200"));
        correlator.dispatch(bid);
        correlator.dispatch(volume);
        correlator.dispatch(new TickSnapshotEndEvent(id));

        Completion completion = correlator.awaitCompletion(id, WAIT);
        assertEquals(new TickSnapshotEndEvent(id), completion.terminal());
        assertEquals(List.of(bid, volume), completion.intermediates(), "Intermediates kept in decode order");
        assertFalse(correlator.isPending(id));
    }

    @Test
    void testResolvesExactlyOnce() {
        long id = submitSnapshot();
        correlator.dispatch(new TickSnapshotEndEvent(id));
        correlator.dispatch(new TickSnapshotEndEvent(id));

        assertEquals(new TickSnapshotEndEvent(id), correlator.awaitOnce(id, WAIT));
        assertEquals(new TickSnapshotEndEvent(id), correlator.awaitOnce(id, WAIT),
            "Awaiting a resolved id returns the same outcome");
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void testWaiterWokenFromAnotherThread() throws Exception {
        long id = submitSnapshot();
        CompletableFuture<InboundEvent> waiter = CompletableFuture.supplyAsync(() -> correlator.awaitOnce(id, WAIT));

        Thread.sleep(50);
        correlator.dispatch(new TickSnapshotEndEvent(id));

        assertEquals(new TickSnapshotEndEvent(id), waiter.get(2, TimeUnit.SECONDS));
    }

    @Test
    void testTimeoutThenLateReplyDropped() {
        long id = submitSnapshot();

        RequestTimeoutException error = assertThrows(RequestTimeoutException.class,
            () -> correlator.awaitOnce(id, Duration.ofMillis(50)));
        assertEquals(id, error.getRequestId());
        assertEquals(RequestType.SNAPSHOT, error.getRequestType());
        assertFalse(correlator.isPending(id), "Registration removed on timeout");

        correlator.dispatch(new TickSnapshotEndEvent(id));
        assertThrows(IllegalArgumentException.class, () -> correlator.awaitOnce(id, WAIT),
            "Late reply does not resurrect the request");
    }

    @Test
    void testUnknownIdRejected() {
        assertThrows(IllegalArgumentException.class, () -> correlator.awaitOnce(4242, WAIT));

        // Nothing registered: dispatch must not throw
        correlator.dispatch(new TickSnapshotEndEvent(4242));
        assertEquals(0, correlator.pendingCount());
    }

    @Test
    void testGatewayErrorFailsRequest() {
        long id = correlator.submit(RequestType.EXECUTIONS,
            requestId -> new ExecutionsRequest(requestId, ExecutionFilter.all()));

        correlator.dispatch(new ErrorEvent(id, 321, "Error validating request"));

        RequestRejectedException error = assertThrows(RequestRejectedException.class,
            () -> correlator.awaitOnce(id, WAIT));
        assertEquals(321, error.getErrorCode());
    }

    @Test
    void testWarningDoesNotFailRequest() {
        long id = correlator.submit(RequestType.EXECUTIONS,
            requestId -> new ExecutionsRequest(requestId, ExecutionFilter.all()));
        ErrorEvent notice = new ErrorEvent(id, 2104, "Market data farm connection is OK");

        correlator.dispatch(notice);
        correlator.dispatch(new ExecDetailsEndEvent(id));

        Completion completion = correlator.awaitCompletion(id, WAIT);
        assertEquals(List.of(notice), completion.intermediates());
    }

    @Test
    void testOrderResolvesOnTerminalStatusOnly() {
        OrderTicket ticket = OrderTicket.limit(GOOG, OrderAction.BUY, new BigDecimal("100"), new BigDecimal("600"))
            .withOrderId(7);
        correlator.submit(7, RequestType.ORDER, new PlaceOrderRequest(ticket));

        correlator.dispatch(status(7, "Submitted", "0", "100"));
        correlator.dispatch(status(7, "Submitted", "40", "60"));
        assertTrue(correlator.isPending(7), "Non-terminal statuses are intermediates");

        correlator.dispatch(status(7, "Filled", "100", "0"));
        Completion completion = correlator.awaitCompletion(7, WAIT);
        assertEquals("Filled", ((OrderStatusEvent) completion.terminal()).status());
        assertEquals(2, completion.intermediates().size());
    }

    @Test
    void testOrderModificationKeepsWaiter() {
        OrderTicket ticket = OrderTicket.limit(GOOG, OrderAction.BUY, new BigDecimal("100"), new BigDecimal("600"))
            .withOrderId(7);
        correlator.submit(7, RequestType.ORDER, new PlaceOrderRequest(ticket));
        correlator.dispatch(status(7, "Submitted", "0", "100"));

        correlator.submit(7, RequestType.ORDER, new PlaceOrderRequest(ticket.toBuilder()
            .limitPrice(new BigDecimal("601")).build()));
        correlator.dispatch(status(7, "Cancelled", "0", "100"));

        Completion completion = correlator.awaitCompletion(7, WAIT);
        assertEquals(1, completion.intermediates().size(), "Intermediates survive the re-send");
        assertEquals(2, sent.size());
    }

    @Test
    void testRearmAfterLostSession() {
        OrderTicket ticket = OrderTicket.limit(GOOG, OrderAction.BUY, new BigDecimal("100"), new BigDecimal("600"))
            .withOrderId(7);
        correlator.submit(7, RequestType.ORDER, new PlaceOrderRequest(ticket));
        correlator.failOutstanding(new ConnectionLostException("127.0.0.1:7496/1", "Connection reset"));
        assertThrows(ConnectionLostException.class, () -> correlator.awaitOnce(7, WAIT));

        assertTrue(correlator.rearm(7, RequestType.ORDER));
        assertFalse(correlator.rearm(7, RequestType.ORDER), "Already waiting");
        correlator.dispatch(status(7, "Filled", "100", "0"));

        assertEquals("Filled", ((OrderStatusEvent) correlator.awaitOnce(7, WAIT)).status());
        assertEquals(1, sent.size(), "Nothing re-sent");
        assertFalse(correlator.rearm(7, RequestType.ORDER), "Resolved ids are left alone");
    }

    @Test
    void testDuplicateIdForDifferentTypeRejected() {
        long id = submitSnapshot();

        assertThrows(IllegalStateException.class,
            () -> correlator.submit(id, RequestType.SNAPSHOT, new MarketDataRequest(id, GOOG, "", true)));
    }

    @Test
    void testChannelRepliesMatchedInOrder() {
        long first = correlator.submit(RequestType.CURRENT_TIME, id -> new CurrentTimeRequest());
        long second = correlator.submit(RequestType.CURRENT_TIME, id -> new CurrentTimeRequest());

        correlator.dispatch(new CurrentTimeEvent(1_000L));
        correlator.dispatch(new CurrentTimeEvent(2_000L));

        assertEquals(new CurrentTimeEvent(1_000L), correlator.awaitOnce(first, WAIT));
        assertEquals(new CurrentTimeEvent(2_000L), correlator.awaitOnce(second, WAIT));
    }

    @Test
    void testUnsolicitedChannelReplyDropped() {
        correlator.dispatch(new CurrentTimeEvent(1_000L));
        long id = correlator.submit(RequestType.OPEN_ORDERS, requestId -> new OpenOrdersRequest());

        correlator.dispatch(new OpenOrderEndEvent());

        assertEquals(new OpenOrderEndEvent(), correlator.awaitOnce(id, WAIT));
    }

    @Test
    void testFailOutstandingKeepsStreams() {
        long snapshot = submitSnapshot();
        List<InboundEvent> streamed = new ArrayList<>();
        long stream = correlator.subscribe(id -> new MarketDataRequest(id, GOOG, "", false), streamed::add);

        correlator.failOutstanding(new ConnectionLostException("127.0.0.1:7496/1", "Connection reset"));

        assertThrows(ConnectionLostException.class, () -> correlator.awaitOnce(snapshot, WAIT));
        assertTrue(correlator.isPending(stream), "Streaming registration survives for replay");

        correlator.dispatch(new TickSizeEvent(stream, 0, BigDecimal.ONE));
        assertEquals(1, streamed.size());
    }

    @Test
    void testStreamingSinkSeesEventsInOrder() {
        List<InboundEvent> streamed = new ArrayList<>();
        long id = correlator.subscribe(requestId -> new MarketDataRequest(requestId, GOOG, "", false), streamed::add);

        List<InboundEvent> ticks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            ticks.add(new TickPriceEvent(id, 1, new BigDecimal(600 + i), BigDecimal.ONE, 0));
        }
        ticks.forEach(correlator::dispatch);

        assertEquals(ticks, streamed);
        assertThrows(IllegalArgumentException.class, () -> correlator.awaitOnce(id, WAIT),
            "Streams cannot be awaited");
    }

    @Test
    void testCancelDropsLaterEvents() {
        List<InboundEvent> streamed = new ArrayList<>();
        long id = correlator.subscribe(requestId -> new MarketDataRequest(requestId, GOOG, "", false), streamed::add);

        assertTrue(correlator.cancel(id));
        correlator.dispatch(new TickSizeEvent(id, 0, BigDecimal.ONE));

        assertTrue(streamed.isEmpty());
        assertFalse(correlator.cancel(id), "Second cancel is a no-op");
    }

    @Test
    void testEncodingFailureRegistersNothing() {
        OrderTicket incomplete = OrderTicket.builder(GOOG, OrderAction.BUY, BigDecimal.TEN).orderId(9).build();

        assertThrows(EncodingException.class,
            () -> correlator.submit(9, RequestType.ORDER, new PlaceOrderRequest(incomplete)));
        assertFalse(correlator.isPending(9));
        assertTrue(sent.isEmpty(), "Nothing written");
    }

    @Test
    void testSendFailureUnregisters() {
        RequestCorrelator offline = new RequestCorrelator(frame -> {
            throw new ConnectionLostException("127.0.0.1:7496/1", "Not connected");
        }, new RequestEncoder(), ids);

        assertThrows(ConnectionLostException.class,
            () -> offline.submit(RequestType.CURRENT_TIME, id -> new CurrentTimeRequest()));
        assertEquals(0, offline.pendingCount());
    }
}
