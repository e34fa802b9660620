package io.twsbridge.domain.request;

public record OpenOrdersRequest() implements ClientRequest {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
