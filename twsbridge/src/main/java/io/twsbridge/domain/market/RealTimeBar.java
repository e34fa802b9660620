package io.twsbridge.domain.market;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Five second bar pushed by a real-time bars subscription.
 */
public record RealTimeBar(
    Instant time,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal wap,
    int count
) {
}
