package io.twsbridge.domain.request;

import io.twsbridge.domain.contract.Contract;

/**
 * Historical bars ending at endDateTime (empty for now).
 *
 * @param duration   look-back window, e.g. "1 D" or "2 W"
 * @param barSize    bar width, e.g. "1 min" or "1 day"
 * @param whatToShow TRADES, MIDPOINT, BID, ASK, ...
 */
public record HistoricalDataRequest(
    long requestId,
    Contract contract,
    String endDateTime,
    String duration,
    String barSize,
    String whatToShow,
    boolean useRth
) implements ClientRequest {

    public HistoricalDataRequest {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (endDateTime == null) {
            endDateTime = "";
        }
    }
}
