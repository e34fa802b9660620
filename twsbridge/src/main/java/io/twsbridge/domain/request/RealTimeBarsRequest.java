package io.twsbridge.domain.request;

import io.twsbridge.domain.contract.Contract;

/**
 * Streaming five second bars.
 */
public record RealTimeBarsRequest(long requestId, Contract contract, String whatToShow, boolean useRth)
    implements ClientRequest {

    /** The only bar width the gateway serves for real-time bars. */
    public static final int BAR_SECONDS = 5;

    public RealTimeBarsRequest {
        if (requestId <= 0) {
            throw new IllegalArgumentException("Request id must be positive");
        }
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (whatToShow == null || whatToShow.isBlank()) {
            whatToShow = "TRADES";
        }
    }
}
