package io.twsbridge.infrastructure.wire;

import java.util.List;

/**
 * An inbound frame could not be interpreted.
 *
 * When {@link #isStreamCorrupt()} is false only the offending frame is lost and
 * decoding continues. A corrupt stream cannot be resynchronised.
 */
public class ProtocolException extends RuntimeException {

    private final boolean streamCorrupt;
    private final List<String> fields;

    public ProtocolException(String message, List<String> fields) {
        super(message);
        this.streamCorrupt = false;
        this.fields = fields;
    }

    public ProtocolException(String message, List<String> fields, Throwable cause) {
        super(message, cause);
        this.streamCorrupt = false;
        this.fields = fields;
    }

    private ProtocolException(String message) {
        super(message);
        this.streamCorrupt = true;
        this.fields = List.of();
    }

    public static ProtocolException streamCorrupt(String message) {
        return new ProtocolException(message);
    }

    public boolean isStreamCorrupt() {
        return streamCorrupt;
    }

    public List<String> getFields() {
        return fields;
    }
}
