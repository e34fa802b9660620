package io.twsbridge.domain.contract;

import java.math.BigDecimal;

/**
 * Instrument descriptor sent with market data and order requests.
 *
 * Messages carry different subsets of these fields; inbound contracts leave
 * the ones their message omits null.
 */
public record Contract(
    long conId,
    String symbol,
    SecType secType,
    String exchange,
    String primaryExchange,
    String currency,
    String localSymbol,
    String expiry,
    BigDecimal strike,
    OptionRight right,
    String multiplier,
    String tradingClass
) {
    public static final String DEFAULT_EXCHANGE = "SMART";
    public static final String DEFAULT_CURRENCY = "USD";

    public Contract {
        if ((symbol == null || symbol.isBlank()) && conId <= 0) {
            throw new IllegalArgumentException("Contract needs a symbol or a conId");
        }
        if (secType == null) {
            secType = SecType.STK;
        }
        if (exchange == null || exchange.isBlank()) {
            exchange = DEFAULT_EXCHANGE;
        }
        if (currency == null || currency.isBlank()) {
            currency = DEFAULT_CURRENCY;
        }
        if (right == null) {
            right = OptionRight.NONE;
        }
        if (strike == null) {
            strike = BigDecimal.ZERO;
        }
    }

    /**
     * SMART-routed USD stock.
     */
    public static Contract stock(String symbol) {
        return builder(symbol).build();
    }

    public static Builder builder(String symbol) {
        return new Builder().symbol(symbol);
    }

    /**
     * Human readable key used in logs.
     */
    public String displayName() {
        if (localSymbol != null && !localSymbol.isBlank()) {
            return localSymbol;
        }
        return symbol != null ? symbol : "conId=" + conId;
    }

    public static class Builder {
        private long conId;
        private String symbol;
        private SecType secType = SecType.STK;
        private String exchange = DEFAULT_EXCHANGE;
        private String primaryExchange;
        private String currency = DEFAULT_CURRENCY;
        private String localSymbol;
        private String expiry;
        private BigDecimal strike = BigDecimal.ZERO;
        private OptionRight right = OptionRight.NONE;
        private String multiplier;
        private String tradingClass;

        public Builder conId(long conId) {
            this.conId = conId;
            return this;
        }

        public Builder symbol(String symbol) {
            this.symbol = symbol;
            return this;
        }

        public Builder secType(SecType secType) {
            this.secType = secType;
            return this;
        }

        public Builder exchange(String exchange) {
            this.exchange = exchange;
            return this;
        }

        public Builder primaryExchange(String primaryExchange) {
            this.primaryExchange = primaryExchange;
            return this;
        }

        public Builder currency(String currency) {
            this.currency = currency;
            return this;
        }

        public Builder localSymbol(String localSymbol) {
            this.localSymbol = localSymbol;
            return this;
        }

        public Builder expiry(String expiry) {
            this.expiry = expiry;
            return this;
        }

        public Builder strike(BigDecimal strike) {
            this.strike = strike;
            return this;
        }

        public Builder right(OptionRight right) {
            this.right = right;
            return this;
        }

        public Builder multiplier(String multiplier) {
            this.multiplier = multiplier;
            return this;
        }

        public Builder tradingClass(String tradingClass) {
            this.tradingClass = tradingClass;
            return this;
        }

        public Contract build() {
            return new Contract(conId, symbol, secType, exchange, primaryExchange, currency,
                localSymbol, expiry, strike, right, multiplier, tradingClass);
        }
    }
}
