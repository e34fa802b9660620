package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.contract.OptionRight;
import io.twsbridge.domain.contract.SecType;

import java.math.BigDecimal;
import java.util.List;

/**
 * Sequential reader over the fields of one decoded frame.
 *
 * Layouts only ever grow at the end, so a reader may stop before the last
 * field; whatever follows is ignored.
 */
final class FieldReader {

    /** Double.MAX_VALUE, which the gateway writes for unset prices. */
    private static final BigDecimal UNSET_DOUBLE = new BigDecimal(Double.toString(Double.MAX_VALUE));

    private final List<String> fields;
    private int position;

    FieldReader(List<String> fields) {
        this.fields = fields;
    }

    boolean hasMore() {
        return position < fields.size();
    }

    String readString() {
        if (position >= fields.size()) {
            throw new ProtocolException("Frame ended after " + fields.size() + " fields", fields);
        }
        return fields.get(position++);
    }

    /**
     * Optional trailing field; empty when absent.
     */
    String readOptionalString() {
        return hasMore() ? readString() : "";
    }

    /**
     * Free text that the gateway escapes to 7-bit ASCII ("\\u00e9") from
     * {@link ServerVersion#ENCODE_MSG_ASCII7} on.
     */
    String readText(boolean escaped) {
        String value = readString();
        return escaped ? unescape(value) : value;
    }

    void skip(int count) {
        for (int i = 0; i < count; i++) {
            readString();
        }
    }

    int readInt() {
        String value = readString();
        if (value.isEmpty()) {
            return 0;
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Field " + (position - 1) + " is not an integer: " + value, fields, e);
        }
    }

    long readLong() {
        String value = readString();
        if (value.isEmpty()) {
            return 0L;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Field " + (position - 1) + " is not a long: " + value, fields, e);
        }
    }

    /**
     * @return the decimal value, or null for an empty field
     */
    BigDecimal readDecimal() {
        String value = readString();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return new BigDecimal(value);
        } catch (NumberFormatException e) {
            throw new ProtocolException("Field " + (position - 1) + " is not a decimal: " + value, fields, e);
        }
    }

    /**
     * Like {@link #readDecimal()}, but the unset marker Double.MAX_VALUE also reads as null.
     */
    BigDecimal readPrice() {
        BigDecimal value = readDecimal();
        return value != null && value.compareTo(UNSET_DOUBLE) >= 0 ? null : value;
    }

    boolean readBoolean() {
        return readInt() != 0;
    }

    SecType readSecType() {
        String value = readString();
        if (value.isEmpty()) {
            return null;
        }
        try {
            return SecType.valueOf(value);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Unknown security type: " + value, fields, e);
        }
    }

    OptionRight readRight() {
        String value = readString();
        try {
            return OptionRight.fromCode(value);
        } catch (IllegalArgumentException e) {
            throw new ProtocolException(e.getMessage(), fields, e);
        }
    }

    static String unescape(String value) {
        int index = value.indexOf("\\u");
        if (index < 0) {
            return value;
        }
        StringBuilder out = new StringBuilder(value.length());
        int i = 0;
        while (i < value.length()) {
            char c = value.charAt(i);
            if (c == '\\' && i + 1 < value.length() && value.charAt(i + 1) == 'u' && isHex(value, i + 2)) {
                out.append((char) Integer.parseInt(value.substring(i + 2, i + 6), 16));
                i += 6;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean isHex(String value, int start) {
        if (start + 4 > value.length()) {
            return false;
        }
        for (int i = start; i < start + 4; i++) {
            if (Character.digit(value.charAt(i), 16) < 0) {
                return false;
            }
        }
        return true;
    }
}
