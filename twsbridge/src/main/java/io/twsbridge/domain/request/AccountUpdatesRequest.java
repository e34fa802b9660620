package io.twsbridge.domain.request;

/**
 * Start or stop the account values and portfolio stream of one account.
 * The gateway serves one such stream per client at a time.
 */
public record AccountUpdatesRequest(boolean subscribe, String account) implements ClientRequest {

    public AccountUpdatesRequest {
        if (account == null) {
            account = "";
        }
    }

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
