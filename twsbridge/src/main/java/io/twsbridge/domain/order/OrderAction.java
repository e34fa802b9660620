package io.twsbridge.domain.order;

/**
 * Order side as exposed to callers.
 *
 * CLOSE is sent as a SELL flagged as a closing order (open/close field "C").
 */
public enum OrderAction {
    BUY("BUY"),
    SELL("SELL"),
    SSHORT("SSHORT"),
    SLONG("SLONG"),
    CLOSE("SELL");

    private final String wireCode;

    OrderAction(String wireCode) {
        this.wireCode = wireCode;
    }

    public String wireCode() {
        return wireCode;
    }

    public boolean isBuySide() {
        return this == BUY || this == SLONG;
    }

    /**
     * Side used by protective child orders of a bracket.
     */
    public OrderAction opposite() {
        return isBuySide() ? SELL : BUY;
    }

    public static OrderAction fromWireCode(String code) {
        if (code == null) {
            throw new IllegalArgumentException("Order action cannot be null");
        }
        return switch (code.trim().toUpperCase()) {
            case "BUY", "BOT" -> BUY;
            case "SELL", "SLD" -> SELL;
            case "SSHORT" -> SSHORT;
            case "SLONG" -> SLONG;
            default -> throw new IllegalArgumentException("Unknown order action: " + code);
        };
    }
}
