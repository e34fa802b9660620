package io.twsbridge.application.correlation;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-wide id counter shared by requests and orders.
 *
 * Ids are never reused: the gateway's next valid id can only move the counter
 * forward.
 */
public class RequestIdGenerator {

    private final AtomicLong next;

    public RequestIdGenerator() {
        this(1L);
    }

    public RequestIdGenerator(long initial) {
        if (initial <= 0) {
            throw new IllegalArgumentException("Initial id must be positive");
        }
        this.next = new AtomicLong(initial);
    }

    public long next() {
        return next.getAndIncrement();
    }

    /**
     * Make sure the next id handed out is at least {@code candidate}.
     */
    public void advanceTo(long candidate) {
        next.accumulateAndGet(candidate, Math::max);
    }

    public long peek() {
        return next.get();
    }
}
