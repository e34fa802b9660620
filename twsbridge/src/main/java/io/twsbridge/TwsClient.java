package io.twsbridge;

import io.twsbridge.application.correlation.Completion;
import io.twsbridge.application.correlation.RequestCorrelator;
import io.twsbridge.application.correlation.RequestIdGenerator;
import io.twsbridge.application.correlation.RequestType;
import io.twsbridge.application.event.EventListenerRegistry;
import io.twsbridge.application.event.ListenerHandle;
import io.twsbridge.application.order.OrderLifecycleManager;
import io.twsbridge.application.order.OrderSender;
import io.twsbridge.application.order.OrderStateException;
import io.twsbridge.application.streaming.RealTimeBarRegistry;
import io.twsbridge.application.streaming.SubscriptionRegistry;
import io.twsbridge.config.ClientConfig;
import io.twsbridge.domain.account.AccountSnapshot;
import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.contract.ContractDetails;
import io.twsbridge.domain.event.AccountDownloadEndEvent;
import io.twsbridge.domain.event.AccountUpdateTimeEvent;
import io.twsbridge.domain.event.AccountValueEvent;
import io.twsbridge.domain.event.ContractDetailsEvent;
import io.twsbridge.domain.event.CurrentTimeEvent;
import io.twsbridge.domain.event.ExecDetailsEvent;
import io.twsbridge.domain.event.HistoricalDataEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.NextValidIdEvent;
import io.twsbridge.domain.event.OpenOrderEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.event.PortfolioValueEvent;
import io.twsbridge.domain.event.PositionEvent;
import io.twsbridge.domain.market.Bar;
import io.twsbridge.domain.market.Quote;
import io.twsbridge.domain.market.RealTimeBar;
import io.twsbridge.domain.order.OrderSnapshot;
import io.twsbridge.domain.order.OrderState;
import io.twsbridge.domain.order.OrderTicket;
import io.twsbridge.domain.request.AccountUpdatesRequest;
import io.twsbridge.domain.request.CancelOrderRequest;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.domain.request.ContractDetailsRequest;
import io.twsbridge.domain.request.CurrentTimeRequest;
import io.twsbridge.domain.request.ExecutionFilter;
import io.twsbridge.domain.request.ExecutionsRequest;
import io.twsbridge.domain.request.ExerciseOptionsRequest;
import io.twsbridge.domain.request.HistoricalDataRequest;
import io.twsbridge.domain.request.OpenOrdersRequest;
import io.twsbridge.domain.request.PlaceOrderRequest;
import io.twsbridge.domain.request.PositionsRequest;
import io.twsbridge.infrastructure.connection.ConnectionInfo;
import io.twsbridge.infrastructure.connection.ConnectionListener;
import io.twsbridge.infrastructure.connection.ConnectionLostException;
import io.twsbridge.infrastructure.connection.ConnectionManager;
import io.twsbridge.infrastructure.connection.ConnectionState;
import io.twsbridge.infrastructure.metrics.ClientMetrics;
import io.twsbridge.infrastructure.metrics.MetricsServer;
import io.twsbridge.infrastructure.metrics.PrometheusClientMetrics;
import io.twsbridge.infrastructure.wire.RequestEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Gateway client: one session, its orders and its market data subscriptions.
 *
 * Every inbound event flows through the same path on the reader thread:
 * order state first, then the waiting request, then typed listeners. A caller
 * woken by {@link #awaitOnce} therefore already sees the updated order.
 *
 * <pre>
 * try (TwsClient client = new TwsClient(ClientConfigLoader.load())) {
 *     client.connect();
 *     long id = client.placeOrder(OrderTicket.limit(Contract.stock("GOOG"), OrderAction.BUY,
 *         new BigDecimal("100"), new BigDecimal("600")));
 *     OrderStatusEvent done = client.awaitOrder(id, Duration.ofMinutes(1));
 * }
 * </pre>
 */
public class TwsClient implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(TwsClient.class);

    private final ClientConfig config;
    private final ClientMetrics metrics;
    private final RequestIdGenerator ids = new RequestIdGenerator();
    private final EventListenerRegistry events = new EventListenerRegistry();
    private final ConnectionManager connection;
    private final RequestCorrelator correlator;
    private final OrderLifecycleManager orders;
    private final SubscriptionRegistry streaming;
    private final RealTimeBarRegistry bars;

    private MetricsServer metricsServer;

    public TwsClient(ClientConfig config) {
        this(config, null);
    }

    /**
     * @param metrics may be null; a Prometheus instance is also served on
     *                {@code config.metricsPort()} when that port is set
     */
    public TwsClient(ClientConfig config, ClientMetrics metrics) {
        if (config == null) {
            throw new IllegalArgumentException("Config cannot be null");
        }
        this.config = config;
        this.metrics = metrics;

        this.connection = new ConnectionManager(config, this::onEvent);
        this.correlator = new RequestCorrelator(connection, new RequestEncoder(), ids);
        this.orders = new OrderLifecycleManager(new CorrelatedOrderSender(), ids);
        this.streaming = new SubscriptionRegistry(correlator, connection);
        this.bars = new RealTimeBarRegistry(correlator);

        connection.setResubscriptionSource(() -> {
            List<ClientRequest> active = new ArrayList<>(streaming.activeRequests());
            active.addAll(bars.activeRequests());
            return active;
        });
        connection.addListener(new ConnectionListener() {
            @Override
            public void onConnectionLost(String reason) {
                correlator.failOutstanding(new ConnectionLostException(connection.getSessionLabel(), reason));
            }

            @Override
            public void onReconnectFailed(int attempts) {
                streaming.destroyAll();
                bars.destroyAll();
            }
        });

        connection.setMetrics(metrics);
        correlator.setMetrics(metrics);
        orders.setMetrics(metrics);
        streaming.setMetrics(metrics);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // CONNECTION
    // ═══════════════════════════════════════════════════════════════════════

    public ConnectionInfo connect() {
        return connect(config.host(), config.port(), config.clientId(), config.connectTimeout());
    }

    public ConnectionInfo connect(String host, int port, int clientId, Duration timeout) {
        startMetricsServer();
        return connection.connect(host, port, clientId, timeout);
    }

    /**
     * Close the session. Subscriptions are destroyed and waiters fail with
     * {@link ConnectionLostException}; tracked orders are kept.
     */
    public void disconnect() {
        streaming.destroyAll();
        bars.destroyAll();
        connection.disconnect();
        correlator.failOutstanding(new ConnectionLostException(connection.getSessionLabel(), "Disconnected"));
    }

    public ConnectionState getConnectionState() {
        return connection.getState();
    }

    public boolean isConnected() {
        return connection.isConnected();
    }

    public ConnectionInfo getConnectionInfo() {
        return connection.getConnectionInfo();
    }

    public void addConnectionListener(ConnectionListener listener) {
        connection.addListener(listener);
    }

    @Override
    public void close() {
        disconnect();
        connection.close();
        streaming.close();
        synchronized (this) {
            if (metricsServer != null) {
                metricsServer.stop();
                metricsServer = null;
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    public long placeOrder(OrderTicket ticket) {
        return orders.submit(ticket, false);
    }

    /**
     * @param hold keep the order local until {@link #transmit(long)}
     */
    public long placeOrder(OrderTicket ticket, boolean hold) {
        return orders.submit(ticket, hold);
    }

    public void transmit(long orderId) {
        orders.transmit(orderId);
    }

    public void amendOrder(long orderId, OrderTicket ticket) {
        orders.amend(orderId, ticket);
    }

    public void cancelOrder(long orderId) {
        orders.cancel(orderId);
    }

    /**
     * Wait for the order's terminal status (FILLED, CANCELLED or REJECTED).
     *
     * Returns at once for an order that already ended. A tracked order whose
     * earlier waiter failed with a lost session is waited on again, so calling
     * this after a reconnect picks up the status the new session reports.
     *
     * @throws OrderStateException if the order is held and was never transmitted
     */
    public OrderStatusEvent awaitOrder(long orderId, Duration timeout) {
        Optional<OrderStatusEvent> ended = orders.terminalStatus(orderId);
        if (ended.isPresent()) {
            return ended.get();
        }
        Optional<OrderSnapshot> tracked = orders.find(orderId);
        if (tracked.isPresent()) {
            if (tracked.get().state() == OrderState.CREATED) {
                throw new OrderStateException(orderId, OrderState.CREATED, "Held order was never transmitted");
            }
            if (correlator.rearm(orderId, RequestType.ORDER)) {
                // the status may have landed between the check and the new waiter
                ended = orders.terminalStatus(orderId);
                if (ended.isPresent()) {
                    correlator.cancel(orderId);
                    return ended.get();
                }
            }
        }
        return (OrderStatusEvent) correlator.awaitOnce(orderId, timeout);
    }

    /**
     * Exercise or lapse an option position. The outcome arrives as order status,
     * execution and error events under the returned id.
     */
    public long exerciseOptions(Contract option, ExerciseOptionsRequest.Action action, int quantity,
                                String account, boolean override) {
        long id = correlator.nextRequestId();
        correlator.send(new ExerciseOptionsRequest(id, option, action, quantity, account, override));
        log.info("[TwsClient] {} {} x {} as request {}", action, option.displayName(), quantity, id);
        return id;
    }

    public Optional<OrderSnapshot> getOrder(long orderId) {
        return orders.find(orderId);
    }

    public List<OrderSnapshot> liveOrders() {
        return orders.liveOrders();
    }

    /**
     * Terminal event of any oneshot request or order.
     */
    public InboundEvent awaitOnce(long requestId, Duration timeout) {
        return correlator.awaitOnce(requestId, timeout);
    }

    public InboundEvent awaitOnce(long requestId) {
        return correlator.awaitOnce(requestId, config.requestTimeout());
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    public long subscribe(Contract contract) {
        return streaming.subscribe(contract, config.quoteBufferCapacity(), 0);
    }

    public long subscribe(Contract contract, int bufferCapacity, int reconnectEvery) {
        return streaming.subscribe(contract, bufferCapacity, reconnectEvery);
    }

    public List<Quote> popAll(long subscriptionId) {
        return streaming.popAll(subscriptionId);
    }

    public List<Quote> peekAll(long subscriptionId) {
        return streaming.peekAll(subscriptionId);
    }

    public Quote latestQuote(long subscriptionId) {
        return streaming.latest(subscriptionId);
    }

    public List<Quote> unsubscribe(long subscriptionId) {
        return streaming.unsubscribe(subscriptionId);
    }

    public Quote requestQuote(Contract contract) {
        return streaming.requestQuote(contract, config.requestTimeout());
    }

    public Quote requestQuote(Contract contract, Duration timeout) {
        return streaming.requestQuote(contract, timeout);
    }

    /**
     * Stream five second bars into a buffer of {@code config.quoteBufferCapacity()} bars.
     *
     * @param whatToShow TRADES, MIDPOINT, BID or ASK
     */
    public long subscribeRealTimeBars(Contract contract, String whatToShow, boolean useRth) {
        return bars.subscribe(contract, whatToShow, useRth, config.quoteBufferCapacity());
    }

    public List<RealTimeBar> popBars(long subscriptionId) {
        return bars.popBars(subscriptionId);
    }

    public List<RealTimeBar> cancelRealTimeBars(long subscriptionId) {
        return bars.cancel(subscriptionId);
    }

    /**
     * Bars ending at {@code endDateTime} (empty for now), all delivered at once.
     *
     * @param duration look-back window such as "2 D"
     * @param barSize  bar width such as "1 hour"
     */
    public List<Bar> requestHistoricalData(Contract contract, String endDateTime, String duration,
                                           String barSize, String whatToShow, boolean useRth) {
        long id = correlator.submit(RequestType.HISTORICAL_DATA, requestId ->
            new HistoricalDataRequest(requestId, contract, endDateTime, duration, barSize, whatToShow, useRth));
        HistoricalDataEvent event = (HistoricalDataEvent) correlator.awaitOnce(id, config.requestTimeout());
        return event.bars();
    }

    /**
     * Every instrument matching a possibly partial contract; an ambiguous symbol
     * yields several entries.
     */
    public List<ContractDetails> requestContractDetails(Contract contract) {
        long id = correlator.submit(RequestType.CONTRACT_DETAILS,
            requestId -> new ContractDetailsRequest(requestId, contract));
        Completion completion = correlator.awaitCompletion(id, config.requestTimeout());
        List<ContractDetails> details = new ArrayList<>();
        for (ContractDetailsEvent event : completion.intermediatesOf(ContractDetailsEvent.class)) {
            details.add(event.details());
        }
        return details;
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT QUERIES
    // ═══════════════════════════════════════════════════════════════════════

    public List<OpenOrderEvent> requestOpenOrders() {
        long id = correlator.submit(RequestType.OPEN_ORDERS, requestId -> new OpenOrdersRequest());
        Completion completion = correlator.awaitCompletion(id, config.requestTimeout());
        return completion.intermediatesOf(OpenOrderEvent.class);
    }

    public List<ExecDetailsEvent> requestExecutions(ExecutionFilter filter) {
        ExecutionFilter effective = filter != null ? filter : ExecutionFilter.all();
        long id = correlator.submit(RequestType.EXECUTIONS, requestId -> new ExecutionsRequest(requestId, effective));
        Completion completion = correlator.awaitCompletion(id, config.requestTimeout());
        return completion.intermediatesOf(ExecDetailsEvent.class);
    }

    public List<PositionEvent> requestPositions() {
        long id = correlator.submit(RequestType.POSITIONS, requestId -> new PositionsRequest());
        Completion completion = correlator.awaitCompletion(id, config.requestTimeout());
        return completion.intermediatesOf(PositionEvent.class);
    }

    /**
     * Download an account's values and portfolio once, then stop the stream.
     * Listeners see the same events while the download runs.
     */
    public AccountSnapshot requestAccountSnapshot(String account) {
        long id = correlator.submit(RequestType.ACCOUNT, requestId -> new AccountUpdatesRequest(true, account));
        Completion completion;
        try {
            completion = correlator.awaitCompletion(id, config.requestTimeout());
        } finally {
            stopAccountUpdates(account);
        }

        String updateTime = "";
        for (AccountUpdateTimeEvent time : completion.intermediatesOf(AccountUpdateTimeEvent.class)) {
            updateTime = time.time();
        }
        String downloaded = ((AccountDownloadEndEvent) completion.terminal()).account();
        return new AccountSnapshot(downloaded.isEmpty() ? account : downloaded,
            completion.intermediatesOf(AccountValueEvent.class),
            completion.intermediatesOf(PortfolioValueEvent.class),
            updateTime);
    }

    private void stopAccountUpdates(String account) {
        try {
            correlator.send(new AccountUpdatesRequest(false, account));
        } catch (ConnectionLostException e) {
            log.debug("[TwsClient] Account updates for {} not stopped, no session: {}", account, e.getMessage());
        }
    }

    public Instant requestCurrentTime() {
        long id = correlator.submit(RequestType.CURRENT_TIME, requestId -> new CurrentTimeRequest());
        CurrentTimeEvent event = (CurrentTimeEvent) correlator.awaitOnce(id, config.requestTimeout());
        return event.time();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // EVENTS
    // ═══════════════════════════════════════════════════════════════════════

    public EventListenerRegistry events() {
        return events;
    }

    public <E extends InboundEvent> ListenerHandle addListener(Class<E> type, Consumer<? super E> listener) {
        return events.addListener(type, listener);
    }

    private void onEvent(InboundEvent event) {
        if (event instanceof NextValidIdEvent) {
            ids.advanceTo(((NextValidIdEvent) event).orderId());
        }

        List<InboundEvent> derived = orders.apply(event);

        correlator.dispatch(event);
        for (InboundEvent synthetic : derived) {
            correlator.dispatch(synthetic);
        }

        events.publish(event);
        for (InboundEvent synthetic : derived) {
            events.publish(synthetic);
        }
    }

    private synchronized void startMetricsServer() {
        if (metricsServer != null || config.metricsPort() <= 0) {
            return;
        }
        if (!(metrics instanceof PrometheusClientMetrics)) {
            log.warn("[TwsClient] metricsPort={} set but no Prometheus metrics supplied", config.metricsPort());
            return;
        }
        metricsServer = new MetricsServer(config.metricsPort(), ((PrometheusClientMetrics) metrics).getRegistry());
        metricsServer.start();
    }

    private final class CorrelatedOrderSender implements OrderSender {

        @Override
        public void place(PlaceOrderRequest request) {
            correlator.submit(request.ticket().orderId(), RequestType.ORDER, request);
        }

        @Override
        public void cancel(CancelOrderRequest request) {
            correlator.send(request);
        }
    }
}
