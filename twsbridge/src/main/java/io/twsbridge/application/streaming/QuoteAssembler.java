package io.twsbridge.application.streaming;

import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.TickPriceEvent;
import io.twsbridge.domain.event.TickSizeEvent;
import io.twsbridge.domain.event.TickStringEvent;
import io.twsbridge.domain.market.Quote;
import io.twsbridge.domain.market.TickType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;

/**
 * Folds tick events into a running view of one ticker and emits an immutable
 * {@link Quote} per relevant tick.
 */
public final class QuoteAssembler {
    private static final Logger log = LoggerFactory.getLogger(QuoteAssembler.class);

    private final long requestId;
    private final String symbol;
    private final Clock clock;

    private BigDecimal bidPrice;
    private BigDecimal bidSize;
    private BigDecimal askPrice;
    private BigDecimal askSize;
    private BigDecimal lastPrice;
    private BigDecimal lastSize;
    private BigDecimal open;
    private BigDecimal high;
    private BigDecimal low;
    private BigDecimal close;
    private BigDecimal volume;
    private Instant eventTime;

    public QuoteAssembler(long requestId, String symbol, Clock clock) {
        this.requestId = requestId;
        this.symbol = symbol;
        this.clock = clock;
    }

    /**
     * @return the new view, or null if the event does not touch a quote field
     */
    public synchronized Quote apply(InboundEvent event) {
        if (event instanceof TickPriceEvent) {
            TickPriceEvent tick = (TickPriceEvent) event;
            TickType type = TickType.fromCode(tick.tickType());
            if (type == null) {
                return null;
            }
            BigDecimal price = tick.price() != null && tick.price().signum() >= 0 ? tick.price() : null;
            setField(type.field(), price);
            if (tick.size() != null) {
                setPairedSize(type.field(), tick.size());
            }
            return snapshot(tick.size());
        }
        if (event instanceof TickSizeEvent) {
            TickSizeEvent tick = (TickSizeEvent) event;
            TickType type = TickType.fromCode(tick.tickType());
            if (type == null) {
                return null;
            }
            setField(type.field(), tick.size());
            return snapshot(tick.size());
        }
        if (event instanceof TickStringEvent) {
            TickStringEvent tick = (TickStringEvent) event;
            TickType type = TickType.fromCode(tick.tickType());
            if (type != TickType.LAST_TIMESTAMP) {
                return null;
            }
            try {
                eventTime = Instant.ofEpochSecond(Long.parseLong(tick.value().trim()));
            } catch (NumberFormatException e) {
                log.debug("[QuoteAssembler] Ignoring malformed timestamp '{}' for {}", tick.value(), symbol);
                return null;
            }
            return snapshot(null);
        }
        return null;
    }

    /**
     * Current view without applying anything.
     */
    public synchronized Quote current() {
        return snapshot(null);
    }

    private void setField(TickType.QuoteField field, BigDecimal value) {
        switch (field) {
            case BID_PRICE -> bidPrice = value;
            case BID_SIZE -> bidSize = value;
            case ASK_PRICE -> askPrice = value;
            case ASK_SIZE -> askSize = value;
            case LAST_PRICE -> lastPrice = value;
            case LAST_SIZE -> lastSize = value;
            case HIGH -> high = value;
            case LOW -> low = value;
            case VOLUME -> volume = value;
            case CLOSE -> close = value;
            case OPEN -> open = value;
            case EVENT_TIME -> { }
        }
    }

    private void setPairedSize(TickType.QuoteField priceField, BigDecimal size) {
        switch (priceField) {
            case BID_PRICE -> bidSize = size;
            case ASK_PRICE -> askSize = size;
            case LAST_PRICE -> lastSize = size;
            default -> { }
        }
    }

    private Quote snapshot(BigDecimal tickSize) {
        return new Quote(requestId, symbol, bidPrice, bidSize, askPrice, askSize, lastPrice, lastSize,
            open, high, low, close, volume, tickSize, clock.instant(), eventTime);
    }
}
