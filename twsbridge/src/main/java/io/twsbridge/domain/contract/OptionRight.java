package io.twsbridge.domain.contract;

/**
 * Option right. NONE is sent as an empty field.
 */
public enum OptionRight {
    NONE(""),
    PUT("P"),
    CALL("C");

    private final String code;

    OptionRight(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    /**
     * Accepts the spellings the gateway and users commonly send: P, PUT, C, CALL.
     */
    public static OptionRight fromCode(String value) {
        if (value == null || value.isBlank() || "0".equals(value) || "?".equals(value)) {
            return NONE;
        }
        return switch (value.trim().toUpperCase()) {
            case "P", "PUT" -> PUT;
            case "C", "CALL" -> CALL;
            default -> throw new IllegalArgumentException("Unknown option right: " + value);
        };
    }
}
