package io.twsbridge.application.streaming;

import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.market.Quote;
import io.twsbridge.domain.request.MarketDataRequest;

import java.time.Clock;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One live market data subscription: its original request (replayed after a
 * reconnect), the running quote view and the buffer callers drain.
 */
public final class StreamingSubscription {

    private final MarketDataRequest request;
    private final QuoteBuffer buffer;
    private final QuoteAssembler assembler;
    private final AtomicLong received = new AtomicLong();

    StreamingSubscription(MarketDataRequest request, int bufferCapacity, Clock clock) {
        this.request = request;
        this.buffer = new QuoteBuffer(bufferCapacity);
        this.assembler = new QuoteAssembler(request.requestId(), request.contract().symbol(), clock);
    }

    /**
     * @return the quote appended to the buffer, or null
     */
    Quote accept(InboundEvent event) {
        Quote quote = assembler.apply(event);
        if (quote != null) {
            buffer.add(quote);
            received.incrementAndGet();
        }
        return quote;
    }

    public long requestId() {
        return request.requestId();
    }

    public Contract contract() {
        return request.contract();
    }

    public MarketDataRequest request() {
        return request;
    }

    public QuoteBuffer buffer() {
        return buffer;
    }

    public Quote latest() {
        return assembler.current();
    }

    public long receivedCount() {
        return received.get();
    }
}
