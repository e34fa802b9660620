package io.twsbridge.infrastructure.wire;

/**
 * A request could not be encoded because it is incomplete or malformed.
 * Nothing was sent.
 */
public class EncodingException extends RuntimeException {

    private final String requestType;

    public EncodingException(String requestType, String message) {
        super(String.format("[%s] %s", requestType, message));
        this.requestType = requestType;
    }

    public String getRequestType() {
        return requestType;
    }
}
