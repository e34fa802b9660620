package io.twsbridge.domain.request;

public record ExecutionsRequest(long requestId, ExecutionFilter filter) implements ClientRequest {

    public ExecutionsRequest {
        if (filter == null) {
            filter = ExecutionFilter.all();
        }
    }
}
