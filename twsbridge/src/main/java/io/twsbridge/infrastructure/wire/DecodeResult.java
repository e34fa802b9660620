package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.event.InboundEvent;

/**
 * Outcome of one decode step: an event, or a request for more bytes.
 */
public final class DecodeResult {

    public static final DecodeResult NEED_MORE_BYTES = new DecodeResult(null);

    private final InboundEvent event;

    private DecodeResult(InboundEvent event) {
        this.event = event;
    }

    public static DecodeResult of(InboundEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("Event cannot be null");
        }
        return new DecodeResult(event);
    }

    public boolean needsMoreBytes() {
        return event == null;
    }

    public InboundEvent event() {
        if (event == null) {
            throw new IllegalStateException("No event decoded yet");
        }
        return event;
    }

    @Override
    public String toString() {
        return event == null ? "NEED_MORE_BYTES" : "DecodeResult[" + event + "]";
    }
}
