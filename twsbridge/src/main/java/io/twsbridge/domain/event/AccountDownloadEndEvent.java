package io.twsbridge.domain.event;

/**
 * Marks the end of the initial account values and portfolio download.
 */
public record AccountDownloadEndEvent(String account) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
