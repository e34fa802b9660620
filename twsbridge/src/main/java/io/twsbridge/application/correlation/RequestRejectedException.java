package io.twsbridge.application.correlation;

/**
 * Exception thrown when the gateway answers a request with an error message.
 */
public class RequestRejectedException extends RuntimeException {

    private final long requestId;
    private final int errorCode;
    private final String errorMessage;

    public RequestRejectedException(long requestId, int errorCode, String errorMessage) {
        super(String.format("[%d] Gateway error %d: %s", requestId, errorCode, errorMessage));
        this.requestId = requestId;
        this.errorCode = errorCode;
        this.errorMessage = errorMessage;
    }

    public long getRequestId() {
        return requestId;
    }

    public int getErrorCode() {
        return errorCode;
    }

    public String getErrorMessage() {
        return errorMessage;
    }
}
