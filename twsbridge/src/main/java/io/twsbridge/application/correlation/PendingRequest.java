package io.twsbridge.application.correlation;

import io.twsbridge.domain.event.InboundEvent;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Registration of one outstanding request. Intermediate events are only
 * touched under the correlator's lock.
 */
final class PendingRequest {

    final long id;
    final RequestType type;
    final RequestKind kind;
    final CompletableFuture<Completion> future = new CompletableFuture<>();
    final List<InboundEvent> intermediates = new ArrayList<>();
    final Consumer<InboundEvent> sink;
    final long createdNanos = System.nanoTime();

    PendingRequest(long id, RequestType type, RequestKind kind, Consumer<InboundEvent> sink) {
        this.id = id;
        this.type = type;
        this.kind = kind;
        this.sink = sink;
    }

    @Override
    public String toString() {
        return "PendingRequest[" + type + ":" + id + ", " + kind + "]";
    }
}
