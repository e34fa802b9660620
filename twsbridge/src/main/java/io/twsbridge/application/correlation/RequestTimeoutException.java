package io.twsbridge.application.correlation;

import java.time.Duration;

/**
 * Exception thrown when no terminal response arrived in time. The registration
 * is gone; late responses are discarded.
 */
public class RequestTimeoutException extends RuntimeException {

    private final long requestId;
    private final RequestType requestType;

    public RequestTimeoutException(long requestId, RequestType requestType, Duration timeout) {
        super(String.format("[%s:%d] No response within %dms", requestType, requestId, timeout.toMillis()));
        this.requestId = requestId;
        this.requestType = requestType;
    }

    public long getRequestId() {
        return requestId;
    }

    public RequestType getRequestType() {
        return requestType;
    }
}
