package io.twsbridge.application.streaming;

import io.twsbridge.domain.market.Quote;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Fixed-capacity FIFO of quotes. When full, the oldest quote is evicted.
 * Thread-safe: the reader appends while callers drain.
 */
public final class QuoteBuffer {

    private final int capacity;
    private final Deque<Quote> quotes;
    private long evicted;

    public QuoteBuffer(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Buffer capacity must be at least 1");
        }
        this.capacity = capacity;
        this.quotes = new ArrayDeque<>(Math.min(capacity, 1024));
    }

    /**
     * @return true if the oldest quote was evicted to make room
     */
    public synchronized boolean add(Quote quote) {
        boolean evict = quotes.size() == capacity;
        if (evict) {
            quotes.pollFirst();
            evicted++;
        }
        quotes.addLast(quote);
        return evict;
    }

    /**
     * Remove and return all buffered quotes, oldest first.
     */
    public synchronized List<Quote> drain() {
        List<Quote> drained = new ArrayList<>(quotes);
        quotes.clear();
        return drained;
    }

    public synchronized List<Quote> peek() {
        return new ArrayList<>(quotes);
    }

    public synchronized int size() {
        return quotes.size();
    }

    public synchronized long evictedCount() {
        return evicted;
    }

    public int capacity() {
        return capacity;
    }
}
