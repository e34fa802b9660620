package io.twsbridge.domain.order;

/**
 * Time in force enum for orders.
 */
public enum TimeInForce {
    DAY,  // Valid for the trading day
    GTC,  // Good Till Cancelled
    IOC,  // Immediate or Cancel
    GTD   // Good Till Date, needs goodTillDate
}
