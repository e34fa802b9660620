package io.twsbridge.domain.market;

import java.util.HashMap;
import java.util.Map;

/**
 * Tick type codes carried by TICK_PRICE, TICK_SIZE and TICK_STRING messages.
 * Delayed variants update the same quote fields as their live counterparts.
 */
public enum TickType {
    BID_SIZE(0, QuoteField.BID_SIZE),
    BID(1, QuoteField.BID_PRICE),
    ASK(2, QuoteField.ASK_PRICE),
    ASK_SIZE(3, QuoteField.ASK_SIZE),
    LAST(4, QuoteField.LAST_PRICE),
    LAST_SIZE(5, QuoteField.LAST_SIZE),
    HIGH(6, QuoteField.HIGH),
    LOW(7, QuoteField.LOW),
    VOLUME(8, QuoteField.VOLUME),
    CLOSE(9, QuoteField.CLOSE),
    OPEN(14, QuoteField.OPEN),
    LAST_TIMESTAMP(45, QuoteField.EVENT_TIME),
    DELAYED_BID(66, QuoteField.BID_PRICE),
    DELAYED_ASK(67, QuoteField.ASK_PRICE),
    DELAYED_LAST(68, QuoteField.LAST_PRICE),
    DELAYED_BID_SIZE(69, QuoteField.BID_SIZE),
    DELAYED_ASK_SIZE(70, QuoteField.ASK_SIZE),
    DELAYED_LAST_SIZE(71, QuoteField.LAST_SIZE),
    DELAYED_HIGH(72, QuoteField.HIGH),
    DELAYED_LOW(73, QuoteField.LOW),
    DELAYED_VOLUME(74, QuoteField.VOLUME),
    DELAYED_CLOSE(75, QuoteField.CLOSE),
    DELAYED_OPEN(76, QuoteField.OPEN);

    private static final Map<Integer, TickType> BY_CODE = new HashMap<>();

    static {
        for (TickType type : values()) {
            BY_CODE.put(type.code, type);
        }
    }

    private final int code;
    private final QuoteField field;

    TickType(int code, QuoteField field) {
        this.code = code;
        this.field = field;
    }

    public int code() {
        return code;
    }

    public QuoteField field() {
        return field;
    }

    /**
     * @return the tick type, or null for codes that do not feed a quote field
     */
    public static TickType fromCode(int code) {
        return BY_CODE.get(code);
    }

    /**
     * Quote fields a tick can update.
     */
    public enum QuoteField {
        BID_PRICE,
        BID_SIZE,
        ASK_PRICE,
        ASK_SIZE,
        LAST_PRICE,
        LAST_SIZE,
        HIGH,
        LOW,
        VOLUME,
        CLOSE,
        OPEN,
        EVENT_TIME
    }
}
