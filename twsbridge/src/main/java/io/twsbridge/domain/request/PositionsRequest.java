package io.twsbridge.domain.request;

public record PositionsRequest() implements ClientRequest {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
