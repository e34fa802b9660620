package io.twsbridge.domain.request;

public record StartApiRequest(int clientId, String optionalCapabilities) implements ClientRequest {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
