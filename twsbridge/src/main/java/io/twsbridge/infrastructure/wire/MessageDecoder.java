package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.contract.ContractDetails;
import io.twsbridge.domain.contract.OptionRight;
import io.twsbridge.domain.contract.SecType;
import io.twsbridge.domain.event.*;
import io.twsbridge.domain.market.Bar;
import io.twsbridge.domain.market.RealTimeBar;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Turns the fields of one frame into a typed event.
 *
 * Layouts follow the gateway's published message formats for the negotiated
 * server version. Several messages also carry their own message version for
 * servers that predate a layout change; both are honoured. Fields past the last
 * one an event needs are left unread. Immutable; one instance per server version.
 */
public final class MessageDecoder {

    private final int serverVersion;

    public MessageDecoder(int serverVersion) {
        this.serverVersion = serverVersion;
    }

    public int serverVersion() {
        return serverVersion;
    }

    /**
     * @throws ProtocolException if the fields do not match the message layout
     */
    public InboundEvent decode(List<String> fields) {
        if (fields.isEmpty()) {
            throw new ProtocolException("Empty frame", fields);
        }
        FieldReader reader = new FieldReader(fields);
        int code = reader.readInt();
        IncomingMessageId messageId = IncomingMessageId.fromCode(code);
        if (messageId == null) {
            return new UnhandledMessageEvent(code, List.copyOf(fields.subList(1, fields.size())));
        }

        return switch (messageId) {
            case TICK_PRICE -> decodeTickPrice(reader);
            case TICK_SIZE -> decodeTickSize(reader);
            case TICK_STRING -> decodeTickString(reader);
            case TICK_SNAPSHOT_END -> {
                reader.readInt();
                yield new TickSnapshotEndEvent(reader.readLong());
            }
            case ORDER_STATUS -> decodeOrderStatus(reader);
            case ERR_MSG -> decodeError(reader);
            case OPEN_ORDER -> decodeOpenOrder(reader);
            case OPEN_ORDER_END -> new OpenOrderEndEvent();
            case ACCT_VALUE -> decodeAccountValue(reader);
            case PORTFOLIO_VALUE -> decodePortfolioValue(reader);
            case ACCT_UPDATE_TIME -> {
                reader.readInt();
                yield new AccountUpdateTimeEvent(reader.readString());
            }
            case ACCT_DOWNLOAD_END -> {
                reader.readInt();
                yield new AccountDownloadEndEvent(reader.readString());
            }
            case NEXT_VALID_ID -> {
                reader.readInt();
                yield new NextValidIdEvent(reader.readLong());
            }
            case CONTRACT_DATA -> decodeContractDetails(reader);
            case CONTRACT_DATA_END -> {
                reader.readInt();
                yield new ContractDetailsEndEvent(reader.readLong());
            }
            case EXECUTION_DATA -> decodeExecution(reader);
            case EXECUTION_DATA_END -> {
                reader.readInt();
                yield new ExecDetailsEndEvent(reader.readLong());
            }
            case HISTORICAL_DATA -> decodeHistoricalData(reader);
            case REAL_TIME_BARS -> decodeRealTimeBar(reader);
            case MANAGED_ACCTS -> decodeManagedAccounts(reader);
            case CURRENT_TIME -> {
                reader.readInt();
                yield new CurrentTimeEvent(reader.readLong());
            }
            case POSITION_DATA -> decodePosition(reader);
            case POSITION_END -> new PositionEndEvent();
        };
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET DATA
    // ═══════════════════════════════════════════════════════════════════════

    private TickPriceEvent decodeTickPrice(FieldReader reader) {
        int version = reader.readInt();
        long requestId = reader.readLong();
        int tickType = reader.readInt();
        BigDecimal price = reader.readDecimal();
        BigDecimal size = version >= 2 ? reader.readDecimal() : null;
        int attributeMask = version >= 3 && reader.hasMore() ? reader.readInt() : 0;
        return new TickPriceEvent(requestId, tickType, price, size, attributeMask);
    }

    private TickSizeEvent decodeTickSize(FieldReader reader) {
        reader.readInt();
        long requestId = reader.readLong();
        int tickType = reader.readInt();
        return new TickSizeEvent(requestId, tickType, reader.readDecimal());
    }

    private TickStringEvent decodeTickString(FieldReader reader) {
        reader.readInt();
        long requestId = reader.readLong();
        int tickType = reader.readInt();
        return new TickStringEvent(requestId, tickType, reader.readString());
    }

    private HistoricalDataEvent decodeHistoricalData(FieldReader reader) {
        int version = serverVersion < ServerVersion.SYNT_REALTIME_BARS ? reader.readInt() : Integer.MAX_VALUE;
        long requestId = reader.readLong();
        String start = "";
        String end = "";
        if (version >= 2) {
            start = reader.readString();
            end = reader.readString();
        }
        int count = reader.readInt();
        List<Bar> bars = new ArrayList<>(Math.max(0, count));
        for (int i = 0; i < count; i++) {
            String time = reader.readString();
            BigDecimal open = reader.readDecimal();
            BigDecimal high = reader.readDecimal();
            BigDecimal low = reader.readDecimal();
            BigDecimal close = reader.readDecimal();
            BigDecimal volume = reader.readDecimal();
            BigDecimal wap = reader.readDecimal();
            if (serverVersion < ServerVersion.SYNT_REALTIME_BARS) {
                reader.skip(1); // hasGaps
            }
            int trades = version >= 3 ? reader.readInt() : -1;
            bars.add(new Bar(time, open, high, low, close, volume, wap, trades));
        }
        return new HistoricalDataEvent(requestId, start, end, List.copyOf(bars));
    }

    private RealTimeBarEvent decodeRealTimeBar(FieldReader reader) {
        reader.readInt();
        long requestId = reader.readLong();
        Instant time = Instant.ofEpochSecond(reader.readLong());
        BigDecimal open = reader.readDecimal();
        BigDecimal high = reader.readDecimal();
        BigDecimal low = reader.readDecimal();
        BigDecimal close = reader.readDecimal();
        BigDecimal volume = reader.readDecimal();
        BigDecimal wap = reader.readDecimal();
        int count = reader.readInt();
        return new RealTimeBarEvent(requestId, new RealTimeBar(time, open, high, low, close, volume, wap, count));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    private OrderStatusEvent decodeOrderStatus(FieldReader reader) {
        int version = serverVersion >= ServerVersion.MARKET_CAP_PRICE ? Integer.MAX_VALUE : reader.readInt();
        long orderId = reader.readLong();
        String status = reader.readString();
        BigDecimal filled = reader.readDecimal();
        BigDecimal remaining = reader.readDecimal();
        BigDecimal avgFillPrice = reader.readDecimal();
        long permId = version >= 2 ? reader.readLong() : 0L;
        long parentId = version >= 3 ? reader.readLong() : 0L;
        BigDecimal lastFillPrice = version >= 4 ? reader.readDecimal() : null;
        int clientId = version >= 5 ? reader.readInt() : 0;
        String whyHeld = version >= 6 ? reader.readOptionalString() : "";
        return new OrderStatusEvent(orderId, status, filled, remaining, avgFillPrice, permId,
            parentId, lastFillPrice, clientId, whyHeld);
    }

    private ErrorEvent decodeError(FieldReader reader) {
        int version = reader.readInt();
        if (version < 2) {
            return new ErrorEvent(InboundEvent.NO_REQUEST_ID, 0, reader.readString());
        }
        long id = reader.readLong();
        int code = reader.readInt();
        return new ErrorEvent(id, code, reader.readText(serverVersion >= ServerVersion.ENCODE_MSG_ASCII7));
    }

    /**
     * Reads the open order layout up to the trigger method. Everything after it
     * (volatility, scale, algo, combo and what-if blocks, order state) is skipped.
     */
    private OpenOrderEvent decodeOpenOrder(FieldReader reader) {
        int version = serverVersion < ServerVersion.ORDER_CONTAINER ? reader.readInt() : serverVersion;
        long orderId = reader.readLong();

        long conId = version >= 17 ? reader.readLong() : 0L;
        String symbol = reader.readString();
        SecType secType = reader.readSecType();
        String expiry = reader.readString();
        BigDecimal strike = reader.readDecimal();
        OptionRight right = reader.readRight();
        String multiplier = version >= 32 ? reader.readString() : null;
        String exchange = reader.readString();
        String currency = reader.readString();
        String localSymbol = version >= 2 ? reader.readString() : null;
        String tradingClass = version >= 32 ? reader.readString() : null;
        Contract contract = contract(Contract.builder(symbol).conId(conId).secType(secType)
            .expiry(expiry).strike(strike).right(right).multiplier(multiplier).exchange(exchange)
            .currency(currency).localSymbol(localSymbol).tradingClass(tradingClass));

        String action = reader.readString();
        BigDecimal quantity = reader.readDecimal();
        String orderType = reader.readString();
        BigDecimal limitPrice = reader.readPrice();
        BigDecimal auxPrice = reader.readPrice();
        String tif = reader.readString();
        String ocaGroup = reader.readString();
        String account = reader.readString();
        reader.skip(2); // openClose, origin
        String orderRef = reader.readString();
        int clientId = version >= 3 ? reader.readInt() : 0;

        long permId = 0L;
        boolean outsideRth = false;
        if (version >= 4) {
            permId = reader.readLong();
            outsideRth = reader.readBoolean();
            reader.skip(2); // hidden, discretionaryAmt
        }
        if (version >= 5) {
            reader.skip(1); // goodAfterTime
        }
        if (version >= 6) {
            reader.skip(1); // sharesAllocation
        }
        if (version >= 7) {
            reader.skip(4); // faGroup, faMethod, faPercentage, faProfile
        }
        if (serverVersion >= ServerVersion.MODELS_SUPPORT) {
            reader.skip(1); // modelCode
        }
        if (version >= 8) {
            reader.skip(1); // goodTillDate
        }

        int ocaType = 0;
        if (version >= 9) {
            reader.skip(5); // rule80A, percentOffset, settlingFirm, shortSaleSlot, designatedLocation
            if (version >= 23) {
                reader.skip(1); // exemptCode
            }
            reader.skip(7); // auctionStrategy, startingPrice, stockRefPrice, delta, range lower/upper, displaySize
            if (version < 18) {
                reader.skip(1); // rthOnly
            }
            reader.skip(4); // blockOrder, sweepToFill, allOrNone, minQty
            ocaType = reader.readInt();
            reader.skip(3); // eTradeOnly, firmQuoteOnly, nbboPriceCap
        }
        long parentId = version >= 10 ? reader.readLong() : 0L;

        return new OpenOrderEvent(orderId, contract, action, quantity, orderType, limitPrice, auxPrice,
            tif, ocaGroup, account, orderRef, clientId, permId, outsideRth, ocaType, parentId);
    }

    private ExecDetailsEvent decodeExecution(FieldReader reader) {
        int version = serverVersion < ServerVersion.LAST_LIQUIDITY ? reader.readInt() : serverVersion;
        long requestId = version >= 7 ? reader.readLong() : InboundEvent.NO_REQUEST_ID;
        long orderId = reader.readLong();

        long conId = version >= 5 ? reader.readLong() : 0L;
        String symbol = reader.readString();
        SecType secType = reader.readSecType();
        String expiry = reader.readString();
        BigDecimal strike = reader.readDecimal();
        OptionRight right = reader.readRight();
        String multiplier = version >= 9 ? reader.readString() : null;
        String contractExchange = reader.readString();
        String currency = reader.readString();
        String localSymbol = reader.readString();
        String tradingClass = version >= 10 ? reader.readString() : null;
        Contract contract = contract(Contract.builder(symbol).conId(conId).secType(secType)
            .expiry(expiry).strike(strike).right(right).multiplier(multiplier).exchange(contractExchange)
            .currency(currency).localSymbol(localSymbol).tradingClass(tradingClass));

        String execId = reader.readString();
        String time = reader.readString();
        String account = reader.readString();
        String exchange = reader.readString();
        String side = reader.readString();
        BigDecimal shares = reader.readDecimal();
        BigDecimal price = reader.readDecimal();
        long permId = version >= 2 ? reader.readLong() : 0L;
        int clientId = version >= 3 ? reader.readInt() : 0;
        int liquidation = version >= 4 ? reader.readInt() : 0;
        BigDecimal cumulativeQuantity = null;
        BigDecimal averagePrice = null;
        if (version >= 6) {
            cumulativeQuantity = reader.readDecimal();
            averagePrice = reader.readDecimal();
        }
        String orderRef = version >= 8 ? reader.readString() : "";

        if (execId.isEmpty()) {
            throw new ProtocolException("Execution without execId for order " + orderId, List.of());
        }
        return new ExecDetailsEvent(requestId, orderId, contract, execId, time, account, exchange, side,
            shares, price, permId, clientId, liquidation, cumulativeQuantity, averagePrice, orderRef);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ACCOUNT
    // ═══════════════════════════════════════════════════════════════════════

    private ManagedAccountsEvent decodeManagedAccounts(FieldReader reader) {
        reader.readInt();
        String list = reader.readString();
        List<String> accounts = new ArrayList<>();
        for (String account : Arrays.asList(list.split(","))) {
            if (!account.isBlank()) {
                accounts.add(account.trim());
            }
        }
        return new ManagedAccountsEvent(List.copyOf(accounts));
    }

    private PositionEvent decodePosition(FieldReader reader) {
        int version = reader.readInt();
        String account = reader.readString();
        long conId = reader.readLong();
        String symbol = reader.readString();
        SecType secType = reader.readSecType();
        String expiry = reader.readString();
        BigDecimal strike = reader.readDecimal();
        OptionRight right = reader.readRight();
        String multiplier = reader.readString();
        String exchange = reader.readString();
        String currency = reader.readString();
        String localSymbol = reader.readString();
        String tradingClass = version >= 2 ? reader.readString() : null;
        Contract contract = contract(Contract.builder(symbol).conId(conId).secType(secType)
            .expiry(expiry).strike(strike).right(right).multiplier(multiplier).exchange(exchange)
            .currency(currency).localSymbol(localSymbol).tradingClass(tradingClass));

        BigDecimal position = reader.readDecimal();
        BigDecimal averageCost = version >= 3 ? reader.readDecimal() : null;
        return new PositionEvent(account, contract, position, averageCost);
    }

    private AccountValueEvent decodeAccountValue(FieldReader reader) {
        int version = reader.readInt();
        String key = reader.readString();
        String value = reader.readString();
        String currency = reader.readString();
        String account = version >= 2 ? reader.readString() : "";
        return new AccountValueEvent(key, value, currency, account);
    }

    private PortfolioValueEvent decodePortfolioValue(FieldReader reader) {
        int version = reader.readInt();
        long conId = version >= 6 ? reader.readLong() : 0L;
        String symbol = reader.readString();
        SecType secType = reader.readSecType();
        String expiry = reader.readString();
        BigDecimal strike = reader.readDecimal();
        OptionRight right = reader.readRight();
        String multiplier = null;
        String primaryExchange = null;
        if (version >= 7) {
            multiplier = reader.readString();
            primaryExchange = reader.readString();
        }
        String currency = reader.readString();
        String localSymbol = version >= 2 ? reader.readString() : null;
        String tradingClass = version >= 8 ? reader.readString() : null;
        Contract contract = contract(Contract.builder(symbol).conId(conId).secType(secType)
            .expiry(expiry).strike(strike).right(right).multiplier(multiplier)
            .primaryExchange(primaryExchange).currency(currency).localSymbol(localSymbol)
            .tradingClass(tradingClass));

        BigDecimal position = reader.readDecimal();
        BigDecimal marketPrice = reader.readDecimal();
        BigDecimal marketValue = reader.readDecimal();
        BigDecimal averageCost = null;
        BigDecimal unrealizedPnl = null;
        BigDecimal realizedPnl = null;
        if (version >= 3) {
            averageCost = reader.readDecimal();
            unrealizedPnl = reader.readPrice();
            realizedPnl = reader.readPrice();
        }
        String account = version >= 4 ? reader.readString() : "";
        return new PortfolioValueEvent(contract, position, marketPrice, marketValue, averageCost,
            unrealizedPnl, realizedPnl, account);
    }

    // ═══════════════════════════════════════════════════════════════════════
    // REFERENCE DATA
    // ═══════════════════════════════════════════════════════════════════════

    /**
     * Reads the contract details layout through the liquid hours. Later blocks
     * (ev rule, security ids, market rules, size rules) are skipped.
     */
    private ContractDetailsEvent decodeContractDetails(FieldReader reader) {
        int version = serverVersion < ServerVersion.SIZE_RULES ? reader.readInt() : 8;
        long requestId = version >= 3 ? reader.readLong() : InboundEvent.NO_REQUEST_ID;

        String symbol = reader.readString();
        SecType secType = reader.readSecType();
        String expiry = firstToken(reader.readString());
        BigDecimal strike = reader.readDecimal();
        OptionRight right = reader.readRight();
        String exchange = reader.readString();
        String currency = reader.readString();
        String localSymbol = reader.readString();
        String marketName = reader.readString();
        String tradingClass = reader.readString();
        long conId = reader.readLong();
        BigDecimal minTick = reader.readDecimal();
        if (serverVersion >= ServerVersion.MD_SIZE_MULTIPLIER && serverVersion < ServerVersion.SIZE_RULES) {
            reader.skip(1); // mdSizeMultiplier
        }
        String multiplier = reader.readString();
        String orderTypes = reader.readString();
        String validExchanges = reader.readString();
        int priceMagnifier = version >= 2 ? reader.readInt() : 1;
        long underConId = version >= 4 ? reader.readLong() : 0L;

        String longName = "";
        String primaryExchange = null;
        if (version >= 5) {
            longName = reader.readText(serverVersion >= ServerVersion.ENCODE_MSG_ASCII7);
            primaryExchange = reader.readString();
        }
        String contractMonth = "";
        String industry = "";
        String category = "";
        String subcategory = "";
        String timeZoneId = "";
        String tradingHours = "";
        String liquidHours = "";
        if (version >= 6) {
            contractMonth = reader.readString();
            industry = reader.readString();
            category = reader.readString();
            subcategory = reader.readString();
            timeZoneId = reader.readString();
            tradingHours = reader.readString();
            liquidHours = reader.readString();
        }

        Contract contract = contract(Contract.builder(symbol).conId(conId).secType(secType)
            .expiry(expiry).strike(strike).right(right).multiplier(multiplier).exchange(exchange)
            .primaryExchange(primaryExchange).currency(currency).localSymbol(localSymbol)
            .tradingClass(tradingClass));
        return new ContractDetailsEvent(requestId, new ContractDetails(contract, marketName, minTick,
            orderTypes, validExchanges, priceMagnifier, underConId, longName, contractMonth, industry,
            category, subcategory, timeZoneId, tradingHours, liquidHours));
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private static Contract contract(Contract.Builder builder) {
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new ProtocolException("Invalid contract block: " + e.getMessage(), List.of(), e);
        }
    }

    /**
     * Last trade dates may carry a time and zone after the date.
     */
    private static String firstToken(String value) {
        String trimmed = value.trim();
        int space = trimmed.indexOf(' ');
        return space < 0 ? trimmed : trimmed.substring(0, space);
    }
}
