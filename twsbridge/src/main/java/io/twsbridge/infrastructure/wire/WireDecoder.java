package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.event.InboundEvent;

import java.util.List;

/**
 * Incremental decoder from a byte stream to events.
 *
 * Feed whatever the socket returned; call {@link #next()} until it reports
 * {@link DecodeResult#NEED_MORE_BYTES}. A frame that fails to parse is consumed
 * before the {@link ProtocolException} is thrown, so the following call resumes
 * with the next frame. Not thread-safe.
 *
 * Until {@link #setServerVersion(int)} is called, messages are read with the
 * layouts of the highest version this client advertises.
 */
public final class WireDecoder {

    private final FrameDecoder frames = new FrameDecoder();
    private MessageDecoder messages;

    public WireDecoder() {
        this(ProtocolVersion.MAX_CLIENT_VERSION);
    }

    public WireDecoder(int serverVersion) {
        this.messages = new MessageDecoder(serverVersion);
    }

    /**
     * Switch to the layouts of the version the handshake negotiated.
     */
    public void setServerVersion(int serverVersion) {
        if (messages.serverVersion() != serverVersion) {
            messages = new MessageDecoder(serverVersion);
        }
    }

    public void feed(byte[] bytes, int offset, int length) {
        frames.feed(bytes, offset, length);
    }

    /**
     * Feed a chunk and return the first decode result.
     */
    public DecodeResult decode(byte[] chunk) {
        frames.feed(chunk);
        return next();
    }

    public DecodeResult next() {
        List<String> fields = frames.nextFrame();
        if (fields == null) {
            return DecodeResult.NEED_MORE_BYTES;
        }
        InboundEvent event = messages.decode(fields);
        return DecodeResult.of(event);
    }

    /**
     * Next complete frame as raw fields, bypassing message decoding.
     * Used for the handshake reply, which is not a message.
     */
    public List<String> nextRawFrame() {
        return frames.nextFrame();
    }

    public int bufferedBytes() {
        return frames.bufferedBytes();
    }
}
