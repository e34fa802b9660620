package io.twsbridge.infrastructure.wire;

/**
 * Server versions at which a message layout this client speaks gained or lost
 * fields. Versions below {@link ProtocolVersion#MIN_CLIENT_VERSION} are never
 * negotiated, so fields introduced before it are always present.
 */
public final class ServerVersion {

    public static final int FRACTIONAL_POSITIONS = 101;
    public static final int PEGGED_TO_BENCHMARK = 102;
    public static final int MODELS_SUPPORT = 103;
    public static final int EXT_OPERATOR = 105;
    public static final int SOFT_DOLLAR_TIER = 106;
    public static final int MD_SIZE_MULTIPLIER = 110;
    public static final int CASH_QTY = 111;
    public static final int SMART_COMPONENTS = 114;
    public static final int SYNT_REALTIME_BARS = 124;
    public static final int MARKET_CAP_PRICE = 131;
    public static final int LAST_LIQUIDITY = 136;
    public static final int DECISION_MAKER = 138;
    public static final int MIFID_EXECUTION = 139;
    public static final int AUTO_PRICE_FOR_HEDGE = 141;
    public static final int ORDER_CONTAINER = 145;
    public static final int D_PEG_ORDERS = 148;
    public static final int PRICE_MGMT_ALGO = 151;
    public static final int ENCODE_MSG_ASCII7 = 153;
    public static final int NO_DEFAULT_OPEN_CLOSE = 155;
    public static final int DURATION = 158;
    public static final int POST_TO_ATS = 160;
    public static final int AUTO_CANCEL_PARENT = 162;
    public static final int SIZE_RULES = 164;
    public static final int ADVANCED_ORDER_REJECT = 166;
    public static final int MANUAL_ORDER_TIME = 169;
    public static final int PEGBEST_PEGMID_OFFSETS = 170;
    public static final int BOND_ISSUERID = 176;

    private ServerVersion() {
    }
}
