package io.twsbridge.domain.request;

public record CancelMarketDataRequest(long requestId) implements ClientRequest {
}
