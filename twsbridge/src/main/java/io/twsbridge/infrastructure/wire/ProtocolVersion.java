package io.twsbridge.infrastructure.wire;

import java.nio.charset.StandardCharsets;

/**
 * Constants of the versioned gateway handshake.
 */
public final class ProtocolVersion {

    /** Lowest server version whose message layouts this client speaks. */
    public static final int MIN_CLIENT_VERSION = 100;

    /** Highest server version this client advertises. */
    public static final int MAX_CLIENT_VERSION = 176;

    /** Largest payload a single frame may carry. */
    public static final int MAX_FRAME_LENGTH = 0xFFFFFF;

    /** Prefix written before the version range string. */
    public static final byte[] API_SIGN = "API\0".getBytes(StandardCharsets.US_ASCII);

    private ProtocolVersion() {
    }

    /**
     * Version range string sent after {@link #API_SIGN}, e.g. "v100..176".
     */
    public static String versionRange() {
        return "v" + MIN_CLIENT_VERSION + ".." + MAX_CLIENT_VERSION;
    }

    public static boolean isSupported(int serverVersion) {
        return serverVersion >= MIN_CLIENT_VERSION && serverVersion <= MAX_CLIENT_VERSION;
    }
}
