package io.twsbridge.domain.request;

public record CancelRealTimeBarsRequest(long requestId) implements ClientRequest {
}
