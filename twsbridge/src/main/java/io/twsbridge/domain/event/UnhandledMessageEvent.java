package io.twsbridge.domain.event;

import java.util.List;

/**
 * Well-formed message of a type this client does not interpret.
 */
public record UnhandledMessageEvent(int messageId, List<String> fields) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
