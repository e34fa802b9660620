package io.twsbridge.infrastructure.wire;

/**
 * Message ids of client-to-gateway requests.
 */
public enum OutgoingMessageId {
    REQ_MKT_DATA(1),
    CANCEL_MKT_DATA(2),
    PLACE_ORDER(3),
    CANCEL_ORDER(4),
    REQ_OPEN_ORDERS(5),
    REQ_ACCOUNT_UPDATES(6),
    REQ_EXECUTIONS(7),
    REQ_IDS(8),
    REQ_CONTRACT_DATA(9),
    REQ_HISTORICAL_DATA(20),
    EXERCISE_OPTIONS(21),
    REQ_CURRENT_TIME(49),
    REQ_REAL_TIME_BARS(50),
    CANCEL_REAL_TIME_BARS(51),
    REQ_POSITIONS(61),
    START_API(71);

    private final int code;

    OutgoingMessageId(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }
}
