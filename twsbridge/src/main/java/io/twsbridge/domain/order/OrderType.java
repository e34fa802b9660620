package io.twsbridge.domain.order;

/**
 * Order types with the price fields each one needs before it can be sent.
 */
public enum OrderType {
    MKT("MKT", false, false),
    MKTCLS("MOC", false, false),
    LMT("LMT", true, false),
    LMTCLS("LOC", true, false),
    PEGMKT("PEG MKT", false, false),
    STP("STP", false, true),
    STPLMT("STP LMT", true, true),
    MIT("MIT", false, true),
    LIT("LIT", true, true),
    REL("REL", false, false),
    TRAIL("TRAIL", false, false),
    TRAILLIMIT("TRAIL LIMIT", true, false);

    private final String wireCode;
    private final boolean requiresLimitPrice;
    private final boolean requiresAuxPrice;

    OrderType(String wireCode, boolean requiresLimitPrice, boolean requiresAuxPrice) {
        this.wireCode = wireCode;
        this.requiresLimitPrice = requiresLimitPrice;
        this.requiresAuxPrice = requiresAuxPrice;
    }

    public String wireCode() {
        return wireCode;
    }

    public boolean requiresLimitPrice() {
        return requiresLimitPrice;
    }

    public boolean requiresAuxPrice() {
        return requiresAuxPrice;
    }

    /**
     * Trailing orders need either an aux (trailing amount) or a trailing percent.
     */
    public boolean isTrailing() {
        return this == TRAIL || this == TRAILLIMIT;
    }

    public static OrderType fromWireCode(String code) {
        for (OrderType type : values()) {
            if (type.wireCode.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown order type: " + code);
    }
}
