package io.twsbridge.domain.event;

import java.util.List;

public record ManagedAccountsEvent(List<String> accounts) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
