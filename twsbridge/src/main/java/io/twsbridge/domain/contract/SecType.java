package io.twsbridge.domain.contract;

/**
 * Security type codes understood by the gateway.
 */
public enum SecType {
    STK,
    OPT,
    FUT,
    IND,
    FOP,
    CASH,
    WAR,
    BOND,
    FUND,
    IOPT,
    SSF,
    CMDTY,
    CFD,
    CRYPTO,
    BAG
}
