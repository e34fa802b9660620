package io.twsbridge.domain.request;

import io.twsbridge.domain.contract.Contract;

/**
 * Streaming (snapshot=false) or one-shot (snapshot=true) quote request.
 *
 * @param genericTickList comma separated generic tick ids, e.g. "100,101,104"
 */
public record MarketDataRequest(
    long requestId,
    Contract contract,
    String genericTickList,
    boolean snapshot
) implements ClientRequest {

    public MarketDataRequest {
        if (requestId <= 0) {
            throw new IllegalArgumentException("Request id must be positive");
        }
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (genericTickList == null) {
            genericTickList = "";
        }
    }
}
