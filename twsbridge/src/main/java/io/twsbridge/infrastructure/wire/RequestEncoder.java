package io.twsbridge.infrastructure.wire;

import io.twsbridge.domain.contract.Contract;
import io.twsbridge.domain.contract.SecType;
import io.twsbridge.domain.order.OrderAction;
import io.twsbridge.domain.order.OrderTicket;
import io.twsbridge.domain.request.*;

import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Encodes typed requests into gateway frames.
 *
 * Field order follows the gateway's published request layouts for the
 * negotiated server version; fields the client does not model are sent with
 * the values the gateway treats as unset. Pure: no state, no I/O. Incomplete
 * requests fail with {@link EncodingException} before any byte is produced.
 */
public final class RequestEncoder {

    private static final int MKT_DATA_VERSION = 11;
    private static final int CANCEL_MKT_DATA_VERSION = 2;
    private static final int PLACE_ORDER_VERSION = 45;
    private static final int EXECUTIONS_VERSION = 3;
    private static final int ACCOUNT_UPDATES_VERSION = 2;
    private static final int CONTRACT_DATA_VERSION = 8;
    private static final int HISTORICAL_DATA_VERSION = 6;
    private static final int EXERCISE_OPTIONS_VERSION = 2;
    private static final int REAL_TIME_BARS_VERSION = 3;
    private static final int START_API_VERSION = 2;

    /**
     * Bytes opening a session: API sign followed by the framed version range.
     */
    public byte[] handshake() {
        byte[] range = FieldWriter.frame(ProtocolVersion.versionRange().getBytes(StandardCharsets.US_ASCII));
        ByteArrayOutputStream out = new ByteArrayOutputStream(ProtocolVersion.API_SIGN.length + range.length);
        out.write(ProtocolVersion.API_SIGN, 0, ProtocolVersion.API_SIGN.length);
        out.write(range, 0, range.length);
        return out.toByteArray();
    }

    /**
     * @param serverVersion version negotiated by the session the frame is written to
     */
    public byte[] encode(ClientRequest request, int serverVersion) {
        if (request == null) {
            throw new EncodingException("UNKNOWN", "Request cannot be null");
        }
        if (request instanceof PlaceOrderRequest) {
            return encodePlaceOrder((PlaceOrderRequest) request, serverVersion);
        }
        if (request instanceof MarketDataRequest) {
            return encodeMarketData((MarketDataRequest) request, serverVersion);
        }
        if (request instanceof CancelMarketDataRequest) {
            return message(OutgoingMessageId.CANCEL_MKT_DATA)
                .add(CANCEL_MKT_DATA_VERSION)
                .add(request.requestId())
                .toFrame();
        }
        if (request instanceof CancelOrderRequest) {
            FieldWriter writer = message(OutgoingMessageId.CANCEL_ORDER)
                .add(1)
                .add(((CancelOrderRequest) request).orderId());
            if (serverVersion >= ServerVersion.MANUAL_ORDER_TIME) {
                writer.add("");                         // manualOrderCancelTime
            }
            return writer.toFrame();
        }
        if (request instanceof ExecutionsRequest) {
            return encodeExecutions((ExecutionsRequest) request);
        }
        if (request instanceof OpenOrdersRequest) {
            return message(OutgoingMessageId.REQ_OPEN_ORDERS).add(1).toFrame();
        }
        if (request instanceof PositionsRequest) {
            return message(OutgoingMessageId.REQ_POSITIONS).add(1).toFrame();
        }
        if (request instanceof CurrentTimeRequest) {
            return message(OutgoingMessageId.REQ_CURRENT_TIME).add(1).toFrame();
        }
        if (request instanceof AccountUpdatesRequest) {
            AccountUpdatesRequest updates = (AccountUpdatesRequest) request;
            return message(OutgoingMessageId.REQ_ACCOUNT_UPDATES)
                .add(ACCOUNT_UPDATES_VERSION)
                .add(updates.subscribe())
                .add(updates.account())
                .toFrame();
        }
        if (request instanceof ContractDetailsRequest) {
            return encodeContractDetails((ContractDetailsRequest) request, serverVersion);
        }
        if (request instanceof HistoricalDataRequest) {
            return encodeHistoricalData((HistoricalDataRequest) request, serverVersion);
        }
        if (request instanceof RealTimeBarsRequest) {
            return encodeRealTimeBars((RealTimeBarsRequest) request);
        }
        if (request instanceof CancelRealTimeBarsRequest) {
            return message(OutgoingMessageId.CANCEL_REAL_TIME_BARS).add(1).add(request.requestId()).toFrame();
        }
        if (request instanceof ExerciseOptionsRequest) {
            return encodeExerciseOptions((ExerciseOptionsRequest) request);
        }
        if (request instanceof NextIdsRequest) {
            int count = ((NextIdsRequest) request).count();
            if (count <= 0) {
                throw new EncodingException("REQ_IDS", "Id count must be positive");
            }
            return message(OutgoingMessageId.REQ_IDS).add(1).add(count).toFrame();
        }
        if (request instanceof StartApiRequest) {
            StartApiRequest start = (StartApiRequest) request;
            return message(OutgoingMessageId.START_API)
                .add(START_API_VERSION)
                .add(start.clientId())
                .add(start.optionalCapabilities())
                .toFrame();
        }
        throw new EncodingException(request.getClass().getSimpleName(), "Unsupported request type");
    }

    // ═══════════════════════════════════════════════════════════════════════
    // ORDERS
    // ═══════════════════════════════════════════════════════════════════════

    private byte[] encodePlaceOrder(PlaceOrderRequest request, int serverVersion) {
        OrderTicket ticket = request.ticket();
        Contract contract = ticket.contract();
        String label = "PLACE_ORDER:" + ticket.orderId();

        List<String> missing = ticket.missingPriceFields();
        if (!missing.isEmpty()) {
            throw new EncodingException(label, "Missing " + String.join(", ", missing)
                + " for " + ticket.orderType().wireCode() + " order");
        }
        checkContract(label, contract);
        if (contract.secType() == SecType.BAG) {
            throw new EncodingException(label, "Combo orders are not supported");
        }

        FieldWriter writer = message(OutgoingMessageId.PLACE_ORDER);
        if (serverVersion < ServerVersion.ORDER_CONTAINER) {
            writer.add(PLACE_ORDER_VERSION);
        }
        writer.add(ticket.orderId())
            .addContract(contract)
            .add("")                                    // secIdType
            .add("")                                    // secId
            .add(ticket.action().wireCode())
            .add(quantity(label, ticket.quantity(), serverVersion))
            .add(ticket.orderType().wireCode())
            .add(ticket.limitPrice())
            .add(ticket.auxPrice())
            .add(ticket.timeInForce().name())
            .add(ticket.ocaGroup())
            .add(ticket.account())
            .add(openClose(ticket, serverVersion))
            .add(0)                                     // origin: customer
            .add(ticket.orderRef())
            .add(ticket.transmit())
            .add(ticket.parentId())
            .add(false)                                 // blockOrder
            .add(false)                                 // sweepToFill
            .add(0)                                     // displaySize
            .add(0)                                     // triggerMethod
            .add(ticket.outsideRth())
            .add(false)                                 // hidden
            .add("")                                    // sharesAllocation
            .add(0)                                     // discretionaryAmt
            .add(ticket.goodAfterTime())
            .add(ticket.goodTillDate())
            .add("")                                    // faGroup
            .add("")                                    // faMethod
            .add("")                                    // faPercentage
            .add("");                                   // faProfile
        if (serverVersion >= ServerVersion.MODELS_SUPPORT) {
            writer.add("");                             // modelCode
        }
        writer.add(0)                                   // shortSaleSlot
            .add("")                                    // designatedLocation
            .add(-1)                                    // exemptCode
            .add(ticket.ocaType().code())
            .add("")                                    // rule80A
            .add("")                                    // settlingFirm
            .add(false)                                 // allOrNone
            .add("")                                    // minQty
            .add("")                                    // percentOffset
            .add(false)                                 // eTradeOnly
            .add(false)                                 // firmQuoteOnly
            .add("")                                    // nbboPriceCap
            .add(0)                                     // auctionStrategy
            .add("")                                    // startingPrice
            .add("")                                    // stockRefPrice
            .add("")                                    // delta
            .add("")                                    // stockRangeLower
            .add("")                                    // stockRangeUpper
            .add(false)                                 // overridePercentageConstraints
            .add("")                                    // volatility
            .add("")                                    // volatilityType
            .add("")                                    // deltaNeutralOrderType
            .add("")                                    // deltaNeutralAuxPrice
            .add(0)                                     // continuousUpdate
            .add("")                                    // referencePriceType
            .add(ticket.trailStopPrice())
            .add(ticket.trailingPercent())
            .add("")                                    // scaleInitLevelSize
            .add("")                                    // scaleSubsLevelSize
            .add("")                                    // scalePriceIncrement
            .add("")                                    // scaleTable
            .add("")                                    // activeStartTime
            .add("")                                    // activeStopTime
            .add("")                                    // hedgeType
            .add(false)                                 // optOutSmartRouting
            .add("")                                    // clearingAccount
            .add("")                                    // clearingIntent
            .add(false)                                 // notHeld
            .add(false)                                 // deltaNeutralContract
            .add("")                                    // algoStrategy
            .add("")                                    // algoId
            .add(ticket.whatIf())
            .add("")                                    // orderMiscOptions
            .add(false)                                 // solicited
            .add(false)                                 // randomizeSize
            .add(false);                                // randomizePrice
        if (serverVersion >= ServerVersion.PEGGED_TO_BENCHMARK) {
            writer.add(0)                               // conditions
                .add("")                                // adjustedOrderType
                .add("")                                // triggerPrice
                .add("")                                // lmtPriceOffset
                .add("")                                // adjustedStopPrice
                .add("")                                // adjustedStopLimitPrice
                .add("")                                // adjustedTrailingAmount
                .add(0);                                // adjustableTrailingUnit
        }
        if (serverVersion >= ServerVersion.EXT_OPERATOR) {
            writer.add("");                             // extOperator
        }
        if (serverVersion >= ServerVersion.SOFT_DOLLAR_TIER) {
            writer.add("").add("");                     // softDollarTier name, value
        }
        if (serverVersion >= ServerVersion.CASH_QTY) {
            writer.add("");                             // cashQty
        }
        if (serverVersion >= ServerVersion.DECISION_MAKER) {
            writer.add("").add("");                     // mifid2DecisionMaker, mifid2DecisionAlgo
        }
        if (serverVersion >= ServerVersion.MIFID_EXECUTION) {
            writer.add("").add("");                     // mifid2ExecutionTrader, mifid2ExecutionAlgo
        }
        if (serverVersion >= ServerVersion.AUTO_PRICE_FOR_HEDGE) {
            writer.add(false);                          // dontUseAutoPriceForHedge
        }
        if (serverVersion >= ServerVersion.ORDER_CONTAINER) {
            writer.add(false);                          // isOmsContainer
        }
        if (serverVersion >= ServerVersion.D_PEG_ORDERS) {
            writer.add(false);                          // discretionaryUpToLimitPrice
        }
        if (serverVersion >= ServerVersion.PRICE_MGMT_ALGO) {
            writer.add("");                             // usePriceMgmtAlgo
        }
        if (serverVersion >= ServerVersion.DURATION) {
            writer.add("");                             // duration
        }
        if (serverVersion >= ServerVersion.POST_TO_ATS) {
            writer.add("");                             // postToAts
        }
        if (serverVersion >= ServerVersion.AUTO_CANCEL_PARENT) {
            writer.add(false);                          // autoCancelParent
        }
        if (serverVersion >= ServerVersion.ADVANCED_ORDER_REJECT) {
            writer.add("");                             // advancedErrorOverride
        }
        if (serverVersion >= ServerVersion.MANUAL_ORDER_TIME) {
            writer.add("");                             // manualOrderTime
        }
        if (serverVersion >= ServerVersion.PEGBEST_PEGMID_OFFSETS && "IBKRATS".equals(contract.exchange())) {
            writer.add("");                             // minTradeQty
        }
        return writer.toFrame();
    }

    /**
     * Whole shares only until the server accepts fractional quantities.
     */
    private static String quantity(String label, BigDecimal quantity, int serverVersion) {
        BigDecimal normalized = quantity.stripTrailingZeros();
        if (serverVersion >= ServerVersion.FRACTIONAL_POSITIONS) {
            return normalized.toPlainString();
        }
        if (normalized.scale() > 0) {
            throw new EncodingException(label, "Server version " + serverVersion
                + " does not accept fractional quantity " + quantity.toPlainString());
        }
        return normalized.toBigInteger().toString();
    }

    /**
     * Servers that stopped defaulting the open/close flag expect it empty for opening orders.
     */
    private static String openClose(OrderTicket ticket, int serverVersion) {
        if (ticket.action() == OrderAction.CLOSE) {
            return "C";
        }
        return serverVersion >= ServerVersion.NO_DEFAULT_OPEN_CLOSE ? "" : "O";
    }

    private byte[] encodeExerciseOptions(ExerciseOptionsRequest request) {
        String label = "EXERCISE_OPTIONS:" + request.requestId();
        Contract contract = request.contract();
        checkContract(label, contract);
        if (contract.secType() != SecType.OPT && contract.secType() != SecType.FOP) {
            throw new EncodingException(label, "Only options can be exercised, not " + contract.secType());
        }

        return message(OutgoingMessageId.EXERCISE_OPTIONS)
            .add(EXERCISE_OPTIONS_VERSION)
            .add(request.requestId())
            .add(contract.conId())
            .add(contract.symbol())
            .add(contract.secType().name())
            .add(contract.expiry())
            .add(contract.strike())
            .add(contract.right().code())
            .add(contract.multiplier())
            .add(contract.exchange())
            .add(contract.currency())
            .add(contract.localSymbol())
            .add(contract.tradingClass())
            .add(request.action().code())
            .add(request.quantity())
            .add(request.account())
            .add(request.override())
            .toFrame();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // MARKET AND REFERENCE DATA
    // ═══════════════════════════════════════════════════════════════════════

    private byte[] encodeMarketData(MarketDataRequest request, int serverVersion) {
        String label = "REQ_MKT_DATA:" + request.requestId();
        checkContract(label, request.contract());
        if (request.contract().secType() == SecType.BAG) {
            throw new EncodingException(label, "Combo contracts are not supported for market data");
        }

        FieldWriter writer = message(OutgoingMessageId.REQ_MKT_DATA)
            .add(MKT_DATA_VERSION)
            .add(request.requestId())
            .addContract(request.contract())
            .add(false)                                 // deltaNeutralContract
            .add(request.genericTickList())
            .add(request.snapshot());
        if (serverVersion >= ServerVersion.SMART_COMPONENTS) {
            writer.add(false);                          // regulatorySnapshot
        }
        return writer.add("")                           // mktDataOptions
            .toFrame();
    }

    private byte[] encodeHistoricalData(HistoricalDataRequest request, int serverVersion) {
        String label = "REQ_HISTORICAL_DATA:" + request.requestId();
        checkContract(label, request.contract());
        if (request.contract().secType() == SecType.BAG) {
            throw new EncodingException(label, "Combo contracts are not supported for historical data");
        }
        requireText(label, "duration", request.duration());
        requireText(label, "barSize", request.barSize());
        requireText(label, "whatToShow", request.whatToShow());

        FieldWriter writer = message(OutgoingMessageId.REQ_HISTORICAL_DATA);
        if (serverVersion < ServerVersion.SYNT_REALTIME_BARS) {
            writer.add(HISTORICAL_DATA_VERSION);
        }
        writer.add(request.requestId())
            .addContract(request.contract())
            .add(0)                                     // includeExpired
            .add(request.endDateTime())
            .add(request.barSize())
            .add(request.duration())
            .add(request.useRth())
            .add(request.whatToShow())
            .add(1);                                    // formatDate: yyyyMMdd HH:mm:ss
        if (serverVersion >= ServerVersion.SYNT_REALTIME_BARS) {
            writer.add(false);                          // keepUpToDate
        }
        return writer.add("")                           // chartOptions
            .toFrame();
    }

    private byte[] encodeRealTimeBars(RealTimeBarsRequest request) {
        String label = "REQ_REAL_TIME_BARS:" + request.requestId();
        checkContract(label, request.contract());

        return message(OutgoingMessageId.REQ_REAL_TIME_BARS)
            .add(REAL_TIME_BARS_VERSION)
            .add(request.requestId())
            .addContract(request.contract())
            .add(RealTimeBarsRequest.BAR_SECONDS)
            .add(request.whatToShow())
            .add(request.useRth())
            .add("")                                    // realTimeBarsOptions
            .toFrame();
    }

    private byte[] encodeContractDetails(ContractDetailsRequest request, int serverVersion) {
        FieldWriter writer = message(OutgoingMessageId.REQ_CONTRACT_DATA)
            .add(CONTRACT_DATA_VERSION)
            .add(request.requestId())
            .addContract(request.contract())
            .add(false)                                 // includeExpired
            .add("")                                    // secIdType
            .add("");                                   // secId
        if (serverVersion >= ServerVersion.BOND_ISSUERID) {
            writer.add("");                             // issuerId
        }
        return writer.toFrame();
    }

    private byte[] encodeExecutions(ExecutionsRequest request) {
        ExecutionFilter filter = request.filter();
        return message(OutgoingMessageId.REQ_EXECUTIONS)
            .add(EXECUTIONS_VERSION)
            .add(request.requestId())
            .add(filter.clientId())
            .add(filter.account())
            .add(filter.time())
            .add(filter.symbol())
            .add(filter.secType())
            .add(filter.exchange())
            .add(filter.side())
            .toFrame();
    }

    // ═══════════════════════════════════════════════════════════════════════
    // HELPERS
    // ═══════════════════════════════════════════════════════════════════════

    private void checkContract(String label, Contract contract) {
        if (contract == null) {
            throw new EncodingException(label, "Contract is required");
        }
        if (contract.secType() == SecType.OPT || contract.secType() == SecType.FOP) {
            if (contract.conId() <= 0 && (contract.expiry() == null || contract.expiry().isBlank())) {
                throw new EncodingException(label, "Option contract needs an expiry or a conId");
            }
        }
    }

    private static void requireText(String label, String field, String value) {
        if (value == null || value.isBlank()) {
            throw new EncodingException(label, field + " is required");
        }
    }

    private static FieldWriter message(OutgoingMessageId id) {
        return new FieldWriter().add(id.code());
    }
}
