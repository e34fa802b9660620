package io.twsbridge.domain.market;

import java.math.BigDecimal;

/**
 * One historical bar. The time is the gateway's formatted bar start, either
 * "yyyyMMdd HH:mm:ss" or "yyyyMMdd" for daily bars.
 *
 * @param wap   volume weighted average price
 * @param count number of trades, or -1 when the gateway does not report it
 */
public record Bar(
    String time,
    BigDecimal open,
    BigDecimal high,
    BigDecimal low,
    BigDecimal close,
    BigDecimal volume,
    BigDecimal wap,
    int count
) {
}
