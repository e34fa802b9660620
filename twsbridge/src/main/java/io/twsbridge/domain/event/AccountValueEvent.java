package io.twsbridge.domain.event;

/**
 * One account key/value pair from an account updates subscription,
 * e.g. NetLiquidation or BuyingPower.
 */
public record AccountValueEvent(String key, String value, String currency, String account) implements InboundEvent {

    @Override
    public long requestId() {
        return NO_REQUEST_ID;
    }
}
