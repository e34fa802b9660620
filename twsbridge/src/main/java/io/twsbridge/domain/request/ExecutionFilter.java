package io.twsbridge.domain.request;

/**
 * Narrows an executions request. Blank fields and clientId 0 match everything.
 *
 * @param time "yyyyMMdd HH:mm:ss", executions after this time
 * @param side BUY or SELL
 */
public record ExecutionFilter(
    int clientId,
    String account,
    String time,
    String symbol,
    String secType,
    String exchange,
    String side
) {
    public static ExecutionFilter all() {
        return new ExecutionFilter(0, "", "", "", "", "", "");
    }

    public static ExecutionFilter forSymbol(String symbol) {
        return new ExecutionFilter(0, "", "", symbol, "", "", "");
    }
}
