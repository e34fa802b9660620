package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.contract.Contract;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * Builds one frame payload of NUL-terminated fields. Null values become empty fields.
 */
final class FieldWriter {

    private final ByteArrayOutputStream payload = new ByteArrayOutputStream(128);

    FieldWriter add(String value) {
        if (value != null) {
            byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
            payload.write(bytes, 0, bytes.length);
        }
        payload.write(0);
        return this;
    }

    FieldWriter add(int value) {
        return add(Integer.toString(value));
    }

    FieldWriter add(long value) {
        return add(Long.toString(value));
    }

    FieldWriter add(boolean value) {
        return add(value ? "1" : "0");
    }

    FieldWriter add(BigDecimal value) {
        return add(value == null ? null : value.toPlainString());
    }

    /**
     * Contract block of the order, market data, historical data, real-time bars
     * and contract details requests, conId through tradingClass.
     */
    FieldWriter addContract(Contract contract) {
        add(contract.conId());
        add(contract.symbol());
        add(contract.secType().name());
        add(contract.expiry());
        add(contract.strike());
        add(contract.right().code());
        add(contract.multiplier());
        add(contract.exchange());
        add(contract.primaryExchange());
        add(contract.currency());
        add(contract.localSymbol());
        add(contract.tradingClass());
        return this;
    }

    /**
     * Length-prefixed frame holding the fields written so far.
     */
    byte[] toFrame() {
        return frame(payload.toByteArray());
    }

    static byte[] frame(byte[] body) {
        ByteBuffer buffer = ByteBuffer.allocate(4 + body.length);
        buffer.putInt(body.length);
        buffer.put(body);
        return buffer.array();
    }
}
