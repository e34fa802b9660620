package io.twsbridge.domain.order;

import java.math.BigDecimal;

/**
 * Stop-loss / take-profit children attached to a parent order.
 *
 * The lower child is priced at parentLimit - lowerDelta and the upper child at
 * parentLimit + upperDelta. Deltas must be positive.
 */
public record BracketSpec(
    BigDecimal lowerDelta,
    BigDecimal upperDelta,
    OrderType lowerType,
    OrderType upperType
) {
    public BracketSpec {
        if (lowerDelta == null || lowerDelta.signum() <= 0) {
            throw new IllegalArgumentException("Lower bracket delta must be positive");
        }
        if (upperDelta == null || upperDelta.signum() <= 0) {
            throw new IllegalArgumentException("Upper bracket delta must be positive");
        }
    }

    /**
     * Same delta on both sides, default child types for the parent's side.
     */
    public static BracketSpec of(BigDecimal delta) {
        return new BracketSpec(delta, delta, null, null);
    }

    public static BracketSpec of(BigDecimal lowerDelta, BigDecimal upperDelta) {
        return new BracketSpec(lowerDelta, upperDelta, null, null);
    }

    /**
     * Child order type for the lower bracket; STP below a buy, LMT below a sell.
     */
    public OrderType lowerTypeFor(OrderAction parentAction) {
        if (lowerType != null) {
            return lowerType;
        }
        return parentAction.isBuySide() ? OrderType.STP : OrderType.LMT;
    }

    /**
     * Child order type for the upper bracket; LMT above a buy, STP above a sell.
     */
    public OrderType upperTypeFor(OrderAction parentAction) {
        if (upperType != null) {
            return upperType;
        }
        return parentAction.isBuySide() ? OrderType.LMT : OrderType.STP;
    }
}
