package io.twsbridge.infrastructure.wire;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Incremental splitter of length-prefixed frames.
 *
 * Bytes are appended with {@link #feed}; {@link #nextFrame()} returns the fields of
 * the next complete frame, or null while the buffer holds only part of one.
 * Not thread-safe; owned by one reader.
 */
public final class FrameDecoder {

    private static final int INITIAL_CAPACITY = 8192;

    private byte[] buffer = new byte[INITIAL_CAPACITY];
    private int readPosition;
    private int writePosition;

    public void feed(byte[] bytes) {
        feed(bytes, 0, bytes.length);
    }

    public void feed(byte[] bytes, int offset, int length) {
        ensureCapacity(length);
        System.arraycopy(bytes, offset, buffer, writePosition, length);
        writePosition += length;
    }

    /**
     * @return fields of the next complete frame, or null if more bytes are needed
     * @throws ProtocolException (stream corrupt) when the length prefix is out of range
     */
    public List<String> nextFrame() {
        int available = writePosition - readPosition;
        if (available < 4) {
            return null;
        }
        int length = ((buffer[readPosition] & 0xFF) << 24)
            | ((buffer[readPosition + 1] & 0xFF) << 16)
            | ((buffer[readPosition + 2] & 0xFF) << 8)
            | (buffer[readPosition + 3] & 0xFF);
        if (length < 0 || length > ProtocolVersion.MAX_FRAME_LENGTH) {
            throw ProtocolException.streamCorrupt("Frame length out of range: " + length);
        }
        if (available - 4 < length) {
            return null;
        }

        int start = readPosition + 4;
        int end = start + length;
        List<String> fields = split(start, end);

        readPosition = end;
        if (readPosition == writePosition) {
            readPosition = 0;
            writePosition = 0;
        }
        return fields;
    }

    /**
     * Bytes received but not yet returned as a frame.
     */
    public int bufferedBytes() {
        return writePosition - readPosition;
    }

    private List<String> split(int start, int end) {
        List<String> fields = new ArrayList<>();
        int fieldStart = start;
        for (int i = start; i < end; i++) {
            if (buffer[i] == 0) {
                fields.add(new String(buffer, fieldStart, i - fieldStart, StandardCharsets.UTF_8));
                fieldStart = i + 1;
            }
        }
        // Unterminated tail, e.g. the bare version string of a handshake
        if (fieldStart < end) {
            fields.add(new String(buffer, fieldStart, end - fieldStart, StandardCharsets.UTF_8));
        }
        return fields;
    }

    private void ensureCapacity(int extra) {
        if (writePosition + extra <= buffer.length) {
            return;
        }
        int pending = writePosition - readPosition;
        if (readPosition > 0) {
            System.arraycopy(buffer, readPosition, buffer, 0, pending);
            readPosition = 0;
            writePosition = pending;
        }
        if (writePosition + extra > buffer.length) {
            int newCapacity = Math.max(buffer.length * 2, writePosition + extra);
            buffer = Arrays.copyOf(buffer, newCapacity);
        }
    }
}
