package io.twsbridge.application.streaming;

import io.twsbridge.application.correlation.Completion;
import io.twsbridge.application.correlation.RequestCorrelator;
import io.twsbridge.application.correlation.RequestType;
import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.market.Quote;
import io.twsbridge.domain.request.CancelMarketDataRequest;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.domain.request.MarketDataRequest;
import io.twsbridge.infrastructure.connection.ConnectionLostException;
import io.twsbridge.infrastructure.connection.ResubscriptionSource;
import io.twsbridge.infrastructure.connection.SessionCycler;
import io.twsbridge.infrastructure.metrics.ClientMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Live market data subscriptions and their quote buffers.
 *
 * A process-wide quote counter can recycle the gateway session every N quotes
 * (some gateway setups throttle long-lived market data lines). The threshold is
 * whatever the most recent {@link #subscribe} call set; zero or less disables it.
 * The cycle runs on its own thread so the reader is never blocked.
 */
public class SubscriptionRegistry implements ResubscriptionSource, AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(SubscriptionRegistry.class);

    private final RequestCorrelator correlator;
    private final SessionCycler cycler;
    private final Clock clock;

    private final Map<Long, StreamingSubscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong quoteCounter = new AtomicLong();
    private final AtomicBoolean cycling = new AtomicBoolean(false);
    private final ExecutorService cycleExecutor;

    private volatile int reconnectEvery;
    private volatile ClientMetrics metrics;

    public SubscriptionRegistry(RequestCorrelator correlator, SessionCycler cycler) {
        this(correlator, cycler, Clock.systemUTC());
    }

    public SubscriptionRegistry(RequestCorrelator correlator, SessionCycler cycler, Clock clock) {
        this.correlator = correlator;
        this.cycler = cycler;
        this.clock = clock;
        this.cycleExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "tws-session-cycle");
            t.setDaemon(true);
            return t;
        });
    }

    public void setMetrics(ClientMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Start streaming quotes for a contract.
     *
     * @param bufferCapacity quotes kept per subscription, at least 1
     * @param reconnectEvery cycle the session after this many quotes across all
     *                       subscriptions; zero or less disables cycling
     * @return the subscription id
     */
    public long subscribe(Contract contract, int bufferCapacity, int reconnectEvery) {
        return subscribe(contract, "", bufferCapacity, reconnectEvery);
    }

    public long subscribe(Contract contract, String genericTickList, int bufferCapacity, int reconnectEvery) {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be at least 1");
        }

        long[] assigned = new long[1];
        try {
            long id = correlator.subscribe(requestId -> {
                assigned[0] = requestId;
                MarketDataRequest request = new MarketDataRequest(requestId, contract, genericTickList, false);
                subscriptions.put(requestId, new StreamingSubscription(request, bufferCapacity, clock));
                return request;
            }, this::onEvent);
            this.reconnectEvery = reconnectEvery;
            log.info("[Streaming] Subscribed {} as {} (buffer={}, reconnectEvery={})",
                contract.displayName(), id, bufferCapacity, reconnectEvery);
            return id;
        } catch (RuntimeException e) {
            if (assigned[0] > 0) {
                subscriptions.remove(assigned[0]);
            }
            throw e;
        }
    }

    /**
     * Remove and return every buffered quote, oldest first. Never blocks.
     */
    public List<Quote> popAll(long subscriptionId) {
        return require(subscriptionId).buffer().drain();
    }

    /**
     * Buffered quotes without draining them.
     */
    public List<Quote> peekAll(long subscriptionId) {
        return require(subscriptionId).buffer().peek();
    }

    /**
     * Running view of the ticker, including fields whose quotes were already drained.
     */
    public Quote latest(long subscriptionId) {
        return require(subscriptionId).latest();
    }

    /**
     * Stop the subscription and return whatever was still buffered.
     */
    public List<Quote> unsubscribe(long subscriptionId) {
        StreamingSubscription subscription = subscriptions.remove(subscriptionId);
        if (subscription == null) {
            throw new IllegalArgumentException("Unknown subscription " + subscriptionId);
        }
        correlator.cancel(subscriptionId);
        try {
            correlator.send(new CancelMarketDataRequest(subscriptionId));
        } catch (ConnectionLostException e) {
            log.warn("[Streaming] Cancel for {} not sent, no session: {}", subscriptionId, e.getMessage());
        }
        List<Quote> unread = subscription.buffer().drain();
        log.info("[Streaming] Unsubscribed {} {} ({} received, {} unread)", subscriptionId,
            subscription.contract().displayName(), subscription.receivedCount(), unread.size());
        return unread;
    }

    /**
     * One-shot quote: request a snapshot and fold the ticks that arrive before
     * the snapshot end marker.
     */
    public Quote requestQuote(Contract contract, Duration timeout) {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        long id = correlator.submit(RequestType.SNAPSHOT,
            requestId -> new MarketDataRequest(requestId, contract, "", true));
        Completion completion = correlator.awaitCompletion(id, timeout);

        QuoteAssembler assembler = new QuoteAssembler(id, contract.symbol(), clock);
        Quote quote = assembler.current();
        for (InboundEvent event : completion.intermediates()) {
            Quote updated = assembler.apply(event);
            if (updated != null) {
                quote = updated;
            }
        }
        return quote;
    }

    /**
     * Drop all subscriptions without sending cancellations (the session is gone).
     */
    public void destroyAll() {
        for (Long id : List.copyOf(subscriptions.keySet())) {
            correlator.cancel(id);
        }
        int count = subscriptions.size();
        subscriptions.clear();
        quoteCounter.set(0);
        if (count > 0) {
            log.info("[Streaming] Destroyed {} subscription(s)", count);
        }
    }

    @Override
    public List<ClientRequest> activeRequests() {
        return subscriptions.values().stream()
            .sorted(Comparator.comparingLong(StreamingSubscription::requestId))
            .map(StreamingSubscription::request)
            .collect(Collectors.toList());
    }

    public boolean isSubscribed(long subscriptionId) {
        return subscriptions.containsKey(subscriptionId);
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public int getReconnectEvery() {
        return reconnectEvery;
    }

    public long getQuoteCounter() {
        return quoteCounter.get();
    }

    @Override
    public void close() {
        cycleExecutor.shutdownNow();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // INBOUND
    // ═══════════════════════════════════════════════════════════════════════

    private void onEvent(InboundEvent event) {
        StreamingSubscription subscription = subscriptions.get(event.requestId());
        if (subscription == null) {
            return;
        }
        if (event instanceof ErrorEvent) {
            ErrorEvent error = (ErrorEvent) event;
            if (error.isWarning()) {
                log.debug("[Streaming] {} notice {}: {}", event.requestId(), error.code(), error.message());
            } else {
                log.warn("[Streaming] {} error {}: {}", event.requestId(), error.code(), error.message());
            }
            return;
        }

        Quote quote = subscription.accept(event);
        if (quote == null) {
            return;
        }
        if (metrics != null) {
            metrics.recordQuote();
        }
        countQuote();
    }

    private void countQuote() {
        int threshold = reconnectEvery;
        if (threshold <= 0) {
            return;
        }
        if (quoteCounter.incrementAndGet() < threshold) {
            return;
        }
        quoteCounter.set(0);
        if (!cycling.compareAndSet(false, true)) {
            return;
        }
        log.info("[Streaming] {} quotes received, cycling session", threshold);
        try {
            cycleExecutor.execute(() -> {
                try {
                    cycler.cycle();
                } catch (RuntimeException e) {
                    log.error("[Streaming] Session cycle failed: {}", e.getMessage(), e);
                } finally {
                    cycling.set(false);
                }
            });
        } catch (RuntimeException e) {
            cycling.set(false);
            log.error("[Streaming] Could not schedule session cycle: {}", e.getMessage());
        }
    }

    private StreamingSubscription require(long subscriptionId) {
        StreamingSubscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            throw new IllegalArgumentException("Unknown subscription " + subscriptionId);
        }
        return subscription;
    }
}
