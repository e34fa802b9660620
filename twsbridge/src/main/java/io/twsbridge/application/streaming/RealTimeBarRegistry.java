package io.twsbridge.application.streaming;

import io.twsbridge.application.correlation.RequestCorrelator;
import io.twsbridge.application.correlation.RequestType;
import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.RealTimeBarEvent;
import io.twsbridge.domain.market.RealTimeBar;
import io.twsbridge.domain.request.CancelRealTimeBarsRequest;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.domain.request.RealTimeBarsRequest;
import io.twsbridge.infrastructure.connection.ConnectionLostException;
import io.twsbridge.infrastructure.connection.ResubscriptionSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Five second bar subscriptions, each with a bounded buffer.
 *
 * Subscriptions are replayed under their original ids after a reconnect, the
 * same way quote subscriptions are. A full buffer drops its oldest bar.
 */
public class RealTimeBarRegistry implements ResubscriptionSource {
    private static final Logger log = LoggerFactory.getLogger(RealTimeBarRegistry.class);

    private final RequestCorrelator correlator;
    private final Map<Long, BarSubscription> subscriptions = new ConcurrentHashMap<>();

    public RealTimeBarRegistry(RequestCorrelator correlator) {
        this.correlator = correlator;
    }

    /**
     * @param whatToShow TRADES, MIDPOINT, BID or ASK
     * @return the subscription id
     */
    public long subscribe(Contract contract, String whatToShow, boolean useRth, int bufferCapacity) {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be at least 1");
        }

        long[] assigned = new long[1];
        try {
            long id = correlator.subscribe(RequestType.REAL_TIME_BARS, requestId -> {
                assigned[0] = requestId;
                RealTimeBarsRequest request = new RealTimeBarsRequest(requestId, contract, whatToShow, useRth);
                subscriptions.put(requestId, new BarSubscription(request, bufferCapacity));
                return request;
            }, this::onEvent);
            log.info("[Streaming] Real-time bars for {} as {} (buffer={})",
                contract.displayName(), id, bufferCapacity);
            return id;
        } catch (RuntimeException e) {
            if (assigned[0] > 0) {
                subscriptions.remove(assigned[0]);
            }
            throw e;
        }
    }

    /**
     * Remove and return every buffered bar, oldest first. Never blocks.
     */
    public List<RealTimeBar> popBars(long subscriptionId) {
        return require(subscriptionId).drain();
    }

    /**
     * Stop the subscription and return whatever was still buffered.
     */
    public List<RealTimeBar> cancel(long subscriptionId) {
        BarSubscription subscription = subscriptions.remove(subscriptionId);
        if (subscription == null) {
            throw new IllegalArgumentException("Unknown bar subscription " + subscriptionId);
        }
        correlator.cancel(subscriptionId);
        try {
            correlator.send(new CancelRealTimeBarsRequest(subscriptionId));
        } catch (ConnectionLostException e) {
            log.warn("[Streaming] Bar cancel for {} not sent, no session: {}", subscriptionId, e.getMessage());
        }
        List<RealTimeBar> unread = subscription.drain();
        log.info("[Streaming] Cancelled real-time bars {} ({} dropped, {} unread)",
            subscriptionId, subscription.droppedCount(), unread.size());
        return unread;
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
        if (count > 0) {
            log.info("[Streaming] Destroyed {} bar subscription(s)", count);
        }
    }

    @Override
    public List<ClientRequest> activeRequests() {
        return subscriptions.values().stream()
            .map(BarSubscription::request)
            .sorted(Comparator.comparingLong(RealTimeBarsRequest::requestId))
            .collect(Collectors.toList());
    }

    public boolean isSubscribed(long subscriptionId) {
        return subscriptions.containsKey(subscriptionId);
    }

    private void onEvent(InboundEvent event) {
        BarSubscription subscription = subscriptions.get(event.requestId());
        if (subscription == null) {
            return;
        }
        if (event instanceof RealTimeBarEvent) {
            subscription.add(((RealTimeBarEvent) event).bar());
        } else if (event instanceof ErrorEvent) {
            ErrorEvent error = (ErrorEvent) event;
            log.warn("[Streaming] Bars {} error {}: {}", event.requestId(), error.code(), error.message());
        }
    }

    private BarSubscription require(long subscriptionId) {
        BarSubscription subscription = subscriptions.get(subscriptionId);
        if (subscription == null) {
            throw new IllegalArgumentException("Unknown bar subscription " + subscriptionId);
        }
        return subscription;
    }

    private static final class BarSubscription {
        private final RealTimeBarsRequest request;
        private final int capacity;
        private final Deque<RealTimeBar> bars = new ArrayDeque<>();
        private long dropped;

        BarSubscription(RealTimeBarsRequest request, int capacity) {
            this.request = request;
            this.capacity = capacity;
        }

        RealTimeBarsRequest request() {
            return request;
        }

        synchronized void add(RealTimeBar bar) {
            if (bars.size() == capacity) {
                bars.pollFirst();
                dropped++;
            }
            bars.addLast(bar);
        }

        synchronized List<RealTimeBar> drain() {
            List<RealTimeBar> drained = new ArrayList<>(bars);
            bars.clear();
            return drained;
        }

        synchronized long droppedCount() {
            return dropped;
        }
    }
}
