package io.twsbridge.domain.request;

public record NextIdsRequest(int count) implements ClientRequest {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
