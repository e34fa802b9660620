package io.twsbridge.domain.request;

/**
 * A typed request to the gateway. Each action has its own record carrying only
 * the fields that action accepts.
 */
public interface ClientRequest {

    long NO_REQUEST_ID = -1L;

    /**
     * Id the gateway will echo back, or {@link #NO_REQUEST_ID} for requests whose
     * replies carry none.
     */
    long requestId();
}
