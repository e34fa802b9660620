package io.twsbridge.application.streaming;

import io.twsbridge.domain.market.Quote;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for QuoteBuffer.
 */
class QuoteBufferTest {

    private static Quote quote(int last) {
        return new Quote(1, "GOOG", null, null, null, null, new BigDecimal(last), null,
            null, null, null, null, null, null, Instant.EPOCH, null);
    }

    private static List<Integer> lastPrices(List<Quote> quotes) {
        return quotes.stream().map(q -> q.lastPrice().intValue()).collect(Collectors.toList());
    }

    @Test
    void testOverflowKeepsNewest() {
        QuoteBuffer buffer = new QuoteBuffer(3);

        for (int i = 1; i <= 5; i++) {
            buffer.add(quote(i));
        }

        assertEquals(List.of(3, 4, 5), lastPrices(buffer.drain()), "Oldest quotes evicted first");
        assertEquals(2, buffer.evictedCount());
        assertEquals(0, buffer.size(), "Drain empties the buffer");
    }

    @Test
    void testAddReportsEviction() {
        QuoteBuffer buffer = new QuoteBuffer(1);

        assertFalse(buffer.add(quote(1)));
        assertTrue(buffer.add(quote(2)));
        assertEquals(List.of(2), lastPrices(buffer.peek()));
    }

    @Test
    void testPeekDoesNotDrain() {
        QuoteBuffer buffer = new QuoteBuffer(10);
        buffer.add(quote(1));
        buffer.add(quote(2));

        assertEquals(List.of(1, 2), lastPrices(buffer.peek()));
        assertEquals(2, buffer.size());
        assertEquals(10, buffer.capacity());
    }

    @Test
    void testDrainOnEmptyBuffer() {
        assertTrue(new QuoteBuffer(5).drain().isEmpty());
    }

    @Test
    void testCapacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new QuoteBuffer(0));
    }
}
