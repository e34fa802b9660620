package io.twsbridge.application.correlation;

import io.twsbridge.domain.event.ErrorEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.request.ClientRequest;
import io.twsbridge.infrastructure.connection.FrameSender;
import io.twsbridge.infrastructure.metrics.ClientMetrics;
import io.twsbridge.infrastructure.wire.RequestEncoder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.LongFunction;

/**
 * Routes inbound events to the request that is waiting for them.
 *
 * Oneshot requests resolve exactly once; repeated terminal events are dropped.
 * Streaming requests forward every event to their sink, on the caller of
 * {@link #dispatch}, in decode order. Events for ids that were cancelled,
 * timed out or failed are dropped silently; events for ids never seen are
 * logged and discarded.
 *
 * Thread-safety: registrations are guarded by one lock; futures and sinks are
 * completed outside it.
 */
public class RequestCorrelator {
    private static final Logger log = LoggerFactory.getLogger(RequestCorrelator.class);

    private static final int HISTORY_SIZE = 4096;

    private final FrameSender sender;
    private final RequestEncoder encoder;
    private final RequestIdGenerator ids;

    private final Object lock = new Object();
    private final Map<Long, PendingRequest> pending = new HashMap<>();
    private final Map<RequestType, Deque<PendingRequest>> channels = new EnumMap<>(RequestType.class);
    private final Map<Long, CompletableFuture<Completion>> resolved = boundedMap();
    private final Set<Long> retired = Collections.newSetFromMap(boundedMap());

    private volatile ClientMetrics metrics;

    public RequestCorrelator(FrameSender sender, RequestEncoder encoder, RequestIdGenerator ids) {
        this.sender = sender;
        this.encoder = encoder;
        this.ids = ids;
    }

    public void setMetrics(ClientMetrics metrics) {
        this.metrics = metrics;
    }

    public long nextRequestId() {
        return ids.next();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // SUBMISSION
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Allocate an id, register a oneshot waiter and send the request.
     *
     * @return the request id to await
     * @throws io.twsbridge.infrastructure.wire.EncodingException if the request is incomplete; nothing is sent
     * @throws io.twsbridge.infrastructure.connection.ConnectionLostException if no session is up
     */
    public long submit(RequestType type, LongFunction<ClientRequest> factory) {
        long id = ids.next();
        submit(id, type, factory.apply(id));
        return id;
    }

    /**
     * Register a oneshot waiter under a caller-allocated id and send the request.
     * Re-sending an order that is still pending keeps its original waiter.
     */
    public void submit(long id, RequestType type, ClientRequest request) {
        byte[] frame = encoder.encode(request, sender.serverVersion());
        PendingRequest registration = register(id, type, RequestKind.ONESHOT, null);
        transmit(registration, frame);
    }

    /**
     * Allocate an id, register a streaming market data sink and send the request.
     */
    public long subscribe(LongFunction<ClientRequest> factory, Consumer<InboundEvent> sink) {
        return subscribe(RequestType.MARKET_DATA, factory, sink);
    }

    public long subscribe(RequestType type, LongFunction<ClientRequest> factory, Consumer<InboundEvent> sink) {
        if (sink == null) {
            throw new IllegalArgumentException("Sink cannot be null");
        }
        long id = ids.next();
        byte[] frame = encoder.encode(factory.apply(id), sender.serverVersion());
        PendingRequest registration = register(id, type, RequestKind.STREAMING, sink);
        transmit(registration, frame);
        return id;
    }

    /**
     * Send a request that expects no correlated reply (cancellations).
     */
    public void send(ClientRequest request) {
        byte[] frame = encoder.encode(request, sender.serverVersion());
        sender.send(frame);
        if (metrics != null) {
            metrics.recordRequestSent(request.getClass().getSimpleName());
        }
    }

    private PendingRequest register(long id, RequestType type, RequestKind kind, Consumer<InboundEvent> sink) {
        synchronized (lock) {
            PendingRequest existing = pending.get(id);
            if (existing != null) {
                if (existing.type == RequestType.ORDER && type == RequestType.ORDER) {
                    return existing;
                }
                throw new IllegalStateException("Request id " + id + " is already pending as " + existing.type);
            }
            PendingRequest registration = new PendingRequest(id, type, kind, sink);
            pending.put(id, registration);
            if (type.isChannel()) {
                channels.computeIfAbsent(type, t -> new ArrayDeque<>()).addLast(registration);
            }
            resolved.remove(id);
            retired.remove(id);
            return registration;
        }
    }

    private void transmit(PendingRequest registration, byte[] frame) {
        try {
            sender.send(frame);
        } catch (RuntimeException e) {
            synchronized (lock) {
                unregister(registration);
            }
            throw e;
        }
        if (metrics != null) {
            metrics.recordRequestSent(registration.type.name());
        }
        log.debug("[Correlator] Sent {}", registration);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // WAITING
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Block until the terminal event for {@code id} arrives.
     *
     * @throws RequestTimeoutException after {@code timeout}; the registration is removed
     * @throws RequestRejectedException if the gateway answered with an error
     * @throws io.twsbridge.infrastructure.connection.ConnectionLostException if the session dropped first
     */
    public InboundEvent awaitOnce(long id, Duration timeout) {
        return awaitCompletion(id, timeout).terminal();
    }

    /**
     * Like {@link #awaitOnce} but also returns the intermediate events.
     * Returns immediately if the request already resolved.
     */
    public Completion awaitCompletion(long id, Duration timeout) {
        PendingRequest registration;
        CompletableFuture<Completion> finished;
        synchronized (lock) {
            registration = pending.get(id);
            finished = registration == null ? resolved.get(id) : null;
        }
        if (registration == null) {
            if (finished == null) {
                throw new IllegalArgumentException("No outstanding request with id " + id);
            }
            return outcome(id, finished);
        }
        if (registration.kind == RequestKind.STREAMING) {
            throw new IllegalArgumentException("Request " + id + " is a streaming subscription");
        }

        try {
            return registration.future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            boolean removed;
            synchronized (lock) {
                removed = pending.get(id) == registration;
                if (removed) {
                    unregister(registration);
                    retired.add(id);
                }
            }
            if (removed) {
                if (metrics != null) {
                    metrics.recordRequestTimeout(registration.type.name());
                }
                log.warn("[Correlator] {} timed out after {}ms", registration, timeout.toMillis());
                throw new RequestTimeoutException(id, registration.type, timeout);
            }
        } catch (ExecutionException e) {
            throw unwrap(id, e);
        } catch (CancellationException e) {
            throw new IllegalStateException("Request " + id + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting request " + id, e);
        }

        // resolved concurrently with the timeout; the outcome is being published
        return outcome(id, registration.future);
    }

    private static Completion outcome(long id, CompletableFuture<Completion> future) {
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw unwrap(id, e);
        } catch (CancellationException e) {
            throw new IllegalStateException("Request " + id + " was cancelled", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting request " + id, e);
        }
    }

    private static RuntimeException unwrap(long id, ExecutionException e) {
        Throwable cause = e.getCause();
        if (cause instanceof RuntimeException) {
            return (RuntimeException) cause;
        }
        return new IllegalStateException("Request " + id + " failed", cause);
    }

    /**
     * Drop a registration. Later events for the id are discarded silently.
     *
     * @return true if the id was registered
     */
    public boolean cancel(long id) {
        PendingRequest registration;
        synchronized (lock) {
            registration = pending.get(id);
            if (registration == null) {
                return false;
            }
            unregister(registration);
            retired.add(id);
        }
        registration.future.cancel(false);
        log.debug("[Correlator] Cancelled {}", registration);
        return true;
    }

    /**
     * Wait again for a oneshot id whose earlier waiter failed with the session,
     * without re-sending anything. An id that is already pending is left alone.
     *
     * @return true if a fresh waiter was registered
     */
    public boolean rearm(long id, RequestType type) {
        synchronized (lock) {
            if (pending.containsKey(id)) {
                return false;
            }
            CompletableFuture<Completion> previous = resolved.get(id);
            if (previous != null && !previous.isCompletedExceptionally()) {
                return false;
            }
            register(id, type, RequestKind.ONESHOT, null);
        }
        log.debug("[Correlator] Re-armed waiter for {} {}", type, id);
        return true;
    }

    public boolean isPending(long id) {
        synchronized (lock) {
            return pending.containsKey(id);
        }
    }

    public int pendingCount() {
        synchronized (lock) {
            return pending.size();
        }
    }

    // ═══════════════════════════════════════════════════════════════════════
    // DISPATCH
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Route one decoded event. Called from the reader thread.
     */
    public void dispatch(InboundEvent event) {
        PendingRequest target;
        Completion completion = null;
        RuntimeException failure = null;

        synchronized (lock) {
            target = route(event);
            if (target == null) {
                return;
            }

            if (target.kind == RequestKind.ONESHOT) {
                if (isFailure(target, event)) {
                    ErrorEvent error = (ErrorEvent) event;
                    unregister(target);
                    resolved.put(target.id, target.future);
                    failure = new RequestRejectedException(target.id, error.code(), error.message());
                } else if (target.type.isTerminal(event)) {
                    unregister(target);
                    completion = new Completion(event, target.intermediates);
                    resolved.put(target.id, target.future);
                } else {
                    target.intermediates.add(event);
                    return;
                }
            }
        }

        if (target.kind == RequestKind.STREAMING) {
            target.sink.accept(event);
            return;
        }

        if (failure != null) {
            log.warn("[Correlator] {} rejected: {}", target, failure.getMessage());
            target.future.completeExceptionally(failure);
            return;
        }

        if (metrics != null) {
            metrics.recordRequestLatency(target.type.name(),
                Duration.ofNanos(System.nanoTime() - target.createdNanos));
        }
        log.debug("[Correlator] {} resolved by {}", target, event.getClass().getSimpleName());
        target.future.complete(completion);
    }

    private boolean isFailure(PendingRequest target, InboundEvent event) {
        if (!(event instanceof ErrorEvent)) {
            return false;
        }
        // order rejections surface as a REJECTED status, not as a failed waiter
        return target.type != RequestType.ORDER && !((ErrorEvent) event).isWarning();
    }

    private PendingRequest route(InboundEvent event) {
        RequestType channel = RequestType.channelOf(event);
        if (channel != null) {
            Deque<PendingRequest> queue = channels.get(channel);
            if (queue != null && !queue.isEmpty()) {
                return queue.peekFirst();
            }
        }

        long id = event.requestId();
        if (id == InboundEvent.NO_REQUEST_ID) {
            if (channel != null) {
                log.trace("[Correlator] Unsolicited {}", event.getClass().getSimpleName());
            }
            return null;
        }

        PendingRequest registration = pending.get(id);
        if (registration != null) {
            return registration;
        }
        if (resolved.containsKey(id)) {
            log.trace("[Correlator] Duplicate {} for resolved id {}", event.getClass().getSimpleName(), id);
            return null;
        }
        if (retired.contains(id)) {
            return null;
        }
        log.warn("[Correlator] Discarding {} for unknown id {}", event.getClass().getSimpleName(), id);
        return null;
    }

    private void unregister(PendingRequest registration) {
        pending.remove(registration.id, registration);
        if (registration.type.isChannel()) {
            Deque<PendingRequest> queue = channels.get(registration.type);
            if (queue != null) {
                queue.remove(registration);
            }
        }
    }

    /**
     * Fail every oneshot waiter. Streaming registrations survive so the
     * subscriptions can be replayed on the next session.
     */
    public void failOutstanding(RuntimeException cause) {
        List<PendingRequest> failed = new ArrayList<>();
        synchronized (lock) {
            for (PendingRequest registration : new ArrayList<>(pending.values())) {
                if (registration.kind == RequestKind.ONESHOT) {
                    unregister(registration);
                    resolved.put(registration.id, registration.future);
                    failed.add(registration);
                }
            }
        }
        for (PendingRequest registration : failed) {
            registration.future.completeExceptionally(cause);
        }
        if (!failed.isEmpty()) {
            log.warn("[Correlator] Failed {} outstanding request(s): {}", failed.size(), cause.getMessage());
        }
    }

    private static <K, V> Map<K, V> boundedMap() {
        return new LinkedHashMap<>() {
            @Override
            protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
                return size() > HISTORY_SIZE;
            }
        };
    }
}
