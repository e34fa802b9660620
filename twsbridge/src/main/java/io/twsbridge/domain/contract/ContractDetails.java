package io.twsbridge.domain.contract;

import java.math.BigDecimal;

/**
 * Reference data for one instrument, as returned by a contract details request.
 *
 * @param orderTypes     comma separated order types the instrument accepts
 * @param validExchanges comma separated exchanges the instrument routes to
 * @param tradingHours   session calendar in the gateway's own format
 */
public record ContractDetails(
    Contract contract,
    String marketName,
    BigDecimal minTick,
    String orderTypes,
    String validExchanges,
    int priceMagnifier,
    long underConId,
    String longName,
    String contractMonth,
    String industry,
    String category,
    String subcategory,
    String timeZoneId,
    String tradingHours,
    String liquidHours
) {
}
