package io.twsbridge.domain.order;

/**
 * One-Cancels-All group behaviour.
 */
public enum OcaType {
    CANCEL_WITH_BLOCK(1),
    REDUCE_WITH_BLOCK(2),
    REDUCE_NON_BLOCK(3);

    private final int code;

    OcaType(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
