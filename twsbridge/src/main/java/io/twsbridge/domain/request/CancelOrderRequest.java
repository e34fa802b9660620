package io.twsbridge.domain.request;

public record CancelOrderRequest(long orderId) implements ClientRequest {

    @Override
    public long requestId() {
        return orderId;
    }
}
