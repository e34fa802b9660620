package io.twsbridge.domain.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Immutable market snapshot for one ticker.
 *
 * Unknown prices are null; a newer view of the market is always a new instance.
 */
public record Quote(
    long requestId,
    String symbol,
    BigDecimal bidPrice,
    BigDecimal bidSize,
    BigDecimal askPrice,
    BigDecimal askSize,
    BigDecimal lastPrice,
    BigDecimal lastSize,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal tickSize,
    Instant arrivalTime,
    Instant eventTime
) {
}
