package io.twsbridge.testing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Inbound gateway messages in their published field order for server version 176.
 *
 * Every builder writes the full frame a 176 gateway sends, including the trailing
 * fields the client does not read, so decoders are tested against real layouts.
 */
public final class GatewayMessages {

    public static final int SERVER_VERSION = 176;
    public static final String ACCOUNT = "DU123";
    public static final int CLIENT_ID = 7;

    private GatewayMessages() {
    }

    /**
     * ORDER_STATUS. No message version since server version 131.
     */
    public static List<String> orderStatus(long orderId, String status, String filled, String remaining,
                                           String avgFillPrice, long parentId) {
        return List.of("3", Long.toString(orderId), status, filled, remaining, avgFillPrice,
            "9001",                             // permId
            Long.toString(parentId),
            avgFillPrice,                       // lastFillPrice
            Integer.toString(CLIENT_ID),
            "",                                 // whyHeld
            "0");                               // mktCapPrice
    }

    /**
     * OPEN_ORDER for a US stock. No message version since server version 145.
     */
    public static List<String> openOrder(long orderId, String symbol, String action, String quantity,
                                         String orderType, String limitPrice, long permId, long parentId) {
        List<String> f = new ArrayList<>();
        Collections.addAll(f, "5", Long.toString(orderId));
        Collections.addAll(f, "265598", symbol, "STK", "", "0", "?", "", "SMART", "USD", symbol, "NMS");
        Collections.addAll(f, action, quantity, orderType, limitPrice,
            "1.7976931348623157E308",           // auxPrice unset
            "DAY", "", ACCOUNT,
            "O", "0",                           // openClose, origin
            "",                                 // orderRef
            Integer.toString(CLIENT_ID), Long.toString(permId),
            "0", "0", "0",                      // outsideRth, hidden, discretionaryAmt
            "",                                 // goodAfterTime
            "",                                 // sharesAllocation
            "", "", "", "",                     // faGroup, faMethod, faPercentage, faProfile
            "",                                 // modelCode
            "",                                 // goodTillDate
            "", "", "", "0", "", "-1",          // rule80A .. exemptCode
            "0", "", "", "", "", "", "0",       // auctionStrategy .. displaySize
            "0", "0", "0", "",                  // blockOrder, sweepToFill, allOrNone, minQty
            "3",                                // ocaType
            "0", "0", "",                       // eTradeOnly, firmQuoteOnly, nbboPriceCap
            Long.toString(parentId),
            "0",                                // triggerMethod
            "", "0", "None", "", "0");         // volatility block, unread
        return List.copyOf(f);
    }

    /**
     * OPEN_ORDER below server version 145, prefixed by message version 34.
     */
    public static List<String> versionedOpenOrder(long orderId, String symbol, String action, String quantity,
                                                  String orderType, String limitPrice, long permId, long parentId) {
        List<String> f = new ArrayList<>(openOrder(orderId, symbol, action, quantity, orderType, limitPrice,
            permId, parentId));
        f.add(1, "34");
        return List.copyOf(f);
    }

    /**
     * EXECUTION_DATA for a US stock. No message version since server version 136.
     */
    public static List<String> execution(long requestId, long orderId, String symbol, String execId, String side,
                                         String shares, String price, String cumulativeQuantity,
                                         String averagePrice) {
        List<String> f = new ArrayList<>();
        Collections.addAll(f, "11", Long.toString(requestId), Long.toString(orderId));
        Collections.addAll(f, "265598", symbol, "STK", "", "0", "", "", "SMART", "USD", symbol, "NMS");
        Collections.addAll(f, execId, "20260105 10:00:01", ACCOUNT,
            "ISLAND",                           // execution exchange
            side, shares, price,
            "9001",                             // permId
            Integer.toString(CLIENT_ID),
            "0",                                // liquidation
            cumulativeQuantity, averagePrice,
            "",                                 // orderRef
            "", "",                             // evRule, evMultiplier
            "",                                 // modelCode
            "1");                               // lastLiquidity
        return List.copyOf(f);
    }

    /**
     * POSITION_DATA, message version 3.
     */
    public static List<String> position(String account, String symbol, String quantity, String averageCost) {
        return List.of("61", "3", account,
            "265598", symbol, "STK", "", "0", "", "",
            "NASDAQ", "USD", symbol, "NMS",
            quantity, averageCost);
    }

    /**
     * ACCT_VALUE, message version 2.
     */
    public static List<String> accountValue(String key, String value, String currency) {
        return List.of("6", "2", key, value, currency, ACCOUNT);
    }

    /**
     * PORTFOLIO_VALUE, message version 8.
     */
    public static List<String> portfolioValue(String symbol, String position, String marketPrice,
                                              String marketValue, String averageCost) {
        return List.of("7", "8",
            "265598", symbol, "STK", "", "0", "", "", "NASDAQ", "USD", symbol, "NMS",
            position, marketPrice, marketValue, averageCost,
            "12.5",                             // unrealizedPNL
            "1.7976931348623157E308",           // realizedPNL unset
            ACCOUNT);
    }

    public static List<String> accountUpdateTime(String time) {
        return List.of("8", "1", time);
    }

    public static List<String> accountDownloadEnd() {
        return List.of("54", "1", ACCOUNT);
    }

    /**
     * HISTORICAL_DATA with two daily bars. No message version since server version 124.
     */
    public static List<String> historicalData(long requestId) {
        return List.of("17", Long.toString(requestId), "20260101 00:00:00", "20260103 00:00:00", "2",
            "20260102", "100.0", "102.5", "99.5", "101.0", "120000", "100.9", "540",
            "20260103", "101.0", "103.0", "100.5", "102.0", "98000", "101.7", "410");
    }

    /**
     * REAL_TIME_BARS, message version 3.
     */
    public static List<String> realTimeBar(long requestId, long epochSecond, String close) {
        return List.of("50", "3", Long.toString(requestId), Long.toString(epochSecond),
            "101.0", "101.5", "100.5", close, "1200", "101.1", "14");
    }

    /**
     * CONTRACT_DATA for a US stock. No message version since server version 164.
     */
    public static List<String> contractDetails(long requestId, String symbol, long conId) {
        List<String> f = new ArrayList<>();
        Collections.addAll(f, "10", Long.toString(requestId),
            symbol, "STK", "", "0", "", "SMART", "USD", symbol,
            "NMS",                              // marketName
            "NMS",                              // tradingClass
            Long.toString(conId), "0.01",
            "",                                 // multiplier
            "LMT,MKT,STP",                      // orderTypes
            "SMART,NASDAQ,ARCA",                // validExchanges
            "1", "0",                           // priceMagnifier, underConId
            "APPLE INC", "NASDAQ",              // longName, primaryExchange
            "", "Technology", "Computers", "Computers",
            "US/Eastern",
            "20260105:0400-20260105:2000",
            "20260105:0930-20260105:1600",
            "", "",                             // evRule, evMultiplier
            "0",                                // secIdList count
            "1", "", "", "26,26", "", "COMMON", "0.0001", "0.0001", "100");
        return List.copyOf(f);
    }

    public static List<String> contractDetailsEnd(long requestId) {
        return List.of("52", "1", Long.toString(requestId));
    }
}
