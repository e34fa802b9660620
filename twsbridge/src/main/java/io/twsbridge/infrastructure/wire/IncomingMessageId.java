package io.twsbridge.infrastructure.wire;

import java.util.HashMap;
import java.util.Map;

/**
 * Message ids of gateway-to-client messages this client interprets.
 */
public enum IncomingMessageId {
    TICK_PRICE(1),
    TICK_SIZE(2),
    ORDER_STATUS(3),
    ERR_MSG(4),
    OPEN_ORDER(5),
    ACCT_VALUE(6),
    PORTFOLIO_VALUE(7),
    ACCT_UPDATE_TIME(8),
    NEXT_VALID_ID(9),
    CONTRACT_DATA(10),
    EXECUTION_DATA(11),
    MANAGED_ACCTS(15),
    HISTORICAL_DATA(17),
    TICK_STRING(46),
    CURRENT_TIME(49),
    REAL_TIME_BARS(50),
    CONTRACT_DATA_END(52),
    OPEN_ORDER_END(53),
    ACCT_DOWNLOAD_END(54),
    EXECUTION_DATA_END(55),
    TICK_SNAPSHOT_END(57),
    POSITION_DATA(61),
    POSITION_END(62);

    private static final Map<Integer, IncomingMessageId> BY_CODE = new HashMap<>();

    static {
        for (IncomingMessageId id : values()) {
            BY_CODE.put(id.code, id);
        }
    }

    private final int code;

    IncomingMessageId(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * @return the message id, or null when this client does not interpret the code
     */
    public static IncomingMessageId fromCode(int code) {
        return BY_CODE.get(code);
    }
}
