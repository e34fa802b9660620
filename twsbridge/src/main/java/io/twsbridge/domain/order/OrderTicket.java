package io.twsbridge.domain.order;

import io.twsbridge.domain.contract.Contract;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Everything needed to place one order.
 *
 * Structural fields are checked on construction. Price completeness depends on
 * the order type and is checked when the order is about to be sent, so a held
 * ticket may be amended before its prices are known.
 */
public record OrderTicket(
    long orderId,
    Contract contract,
    OrderAction action,
    OrderType orderType,
    BigDecimal quantity,
    BigDecimal limitPrice,
    BigDecimal auxPrice,
    TimeInForce timeInForce,
    String ocaGroup,
    OcaType ocaType,
    long parentId,
    boolean transmit,
    String account,
    String orderRef,
    boolean outsideRth,
    String goodAfterTime,
    String goodTillDate,
    BigDecimal trailingPercent,
    BigDecimal trailStopPrice,
    boolean whatIf,
    BracketSpec bracket
) {
    public OrderTicket {
        if (contract == null) {
            throw new IllegalArgumentException("Contract cannot be null");
        }
        if (action == null) {
            throw new IllegalArgumentException("Action cannot be null");
        }
        if (orderType == null) {
            throw new IllegalArgumentException("Order type cannot be null");
        }
        if (quantity == null || quantity.signum() <= 0) {
            throw new IllegalArgumentException("Quantity must be positive");
        }
        if (orderId < 0 || parentId < 0) {
            throw new IllegalArgumentException("Order and parent ids cannot be negative");
        }
        if (timeInForce == null) {
            timeInForce = TimeInForce.GTC;
        }
        if (ocaType == null) {
            ocaType = OcaType.REDUCE_WITH_BLOCK;
        }
    }

    /**
     * Names of fields the order type needs but that are unset.
     */
    public List<String> missingPriceFields() {
        List<String> missing = new ArrayList<>();
        if (orderType.requiresLimitPrice() && limitPrice == null) {
            missing.add("limitPrice");
        }
        if (orderType.requiresAuxPrice() && auxPrice == null) {
            missing.add("auxPrice");
        }
        if (orderType.isTrailing() && auxPrice == null && trailingPercent == null) {
            missing.add("auxPrice or trailingPercent");
        }
        if (timeInForce == TimeInForce.GTD && (goodTillDate == null || goodTillDate.isBlank())) {
            missing.add("goodTillDate");
        }
        if (bracket != null && limitPrice == null) {
            missing.add("limitPrice (bracket base)");
        }
        return missing;
    }

    public boolean hasBracket() {
        return bracket != null;
    }

    public OrderTicket withOrderId(long newOrderId) {
        return toBuilder().orderId(newOrderId).build();
    }

    public OrderTicket withTransmit(boolean newTransmit) {
        return toBuilder().transmit(newTransmit).build();
    }

    public static Builder builder(Contract contract, OrderAction action, BigDecimal quantity) {
        return new Builder().contract(contract).action(action).quantity(quantity);
    }

    /**
     * Limit order, the default order type.
     */
    public static OrderTicket limit(Contract contract, OrderAction action, BigDecimal quantity,
                                    BigDecimal limitPrice) {
        return builder(contract, action, quantity).limitPrice(limitPrice).build();
    }

    public static OrderTicket market(Contract contract, OrderAction action, BigDecimal quantity) {
        return builder(contract, action, quantity).orderType(OrderType.MKT).build();
    }

    public Builder toBuilder() {
        return new Builder()
            .orderId(orderId)
            .contract(contract)
            .action(action)
            .orderType(orderType)
            .quantity(quantity)
            .limitPrice(limitPrice)
            .auxPrice(auxPrice)
            .timeInForce(timeInForce)
            .ocaGroup(ocaGroup)
            .ocaType(ocaType)
            .parentId(parentId)
            .transmit(transmit)
            .account(account)
            .orderRef(orderRef)
            .outsideRth(outsideRth)
            .goodAfterTime(goodAfterTime)
            .goodTillDate(goodTillDate)
            .trailingPercent(trailingPercent)
            .trailStopPrice(trailStopPrice)
            .whatIf(whatIf)
            .bracket(bracket);
    }

    public static class Builder {
        private long orderId;
        private Contract contract;
        private OrderAction action;
        private OrderType orderType = OrderType.LMT;
        private BigDecimal quantity;
        private BigDecimal limitPrice;
        private BigDecimal auxPrice;
        private TimeInForce timeInForce = TimeInForce.GTC;
        private String ocaGroup;
        private OcaType ocaType = OcaType.REDUCE_WITH_BLOCK;
        private long parentId;
        private boolean transmit = true;
        private String account;
        private String orderRef;
        private boolean outsideRth;
        private String goodAfterTime;
        private String goodTillDate;
        private BigDecimal trailingPercent;
        private BigDecimal trailStopPrice;
        private boolean whatIf;
        private BracketSpec bracket;

        public Builder orderId(long orderId) {
            this.orderId = orderId;
            return this;
        }

        public Builder contract(Contract contract) {
            this.contract = contract;
            return this;
        }

        public Builder action(OrderAction action) {
            this.action = action;
            return this;
        }

        public Builder orderType(OrderType orderType) {
            this.orderType = orderType;
            return this;
        }

        public Builder quantity(BigDecimal quantity) {
            this.quantity = quantity;
            return this;
        }

        public Builder limitPrice(BigDecimal limitPrice) {
            this.limitPrice = limitPrice;
            return this;
        }

        public Builder auxPrice(BigDecimal auxPrice) {
            this.auxPrice = auxPrice;
            return this;
        }

        public Builder timeInForce(TimeInForce timeInForce) {
            this.timeInForce = timeInForce;
            return this;
        }

        public Builder ocaGroup(String ocaGroup) {
            this.ocaGroup = ocaGroup;
            return this;
        }

        public Builder ocaType(OcaType ocaType) {
            this.ocaType = ocaType;
            return this;
        }

        public Builder parentId(long parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder transmit(boolean transmit) {
            this.transmit = transmit;
            return this;
        }

        public Builder account(String account) {
            this.account = account;
            return this;
        }

        public Builder orderRef(String orderRef) {
            this.orderRef = orderRef;
            return this;
        }

        public Builder outsideRth(boolean outsideRth) {
            this.outsideRth = outsideRth;
            return this;
        }

        public Builder goodAfterTime(String goodAfterTime) {
            this.goodAfterTime = goodAfterTime;
            return this;
        }

        public Builder goodTillDate(String goodTillDate) {
            this.goodTillDate = goodTillDate;
            return this;
        }

        public Builder trailingPercent(BigDecimal trailingPercent) {
            this.trailingPercent = trailingPercent;
            return this;
        }

        public Builder trailStopPrice(BigDecimal trailStopPrice) {
            this.trailStopPrice = trailStopPrice;
            return this;
        }

        public Builder whatIf(boolean whatIf) {
            this.whatIf = whatIf;
            return this;
        }

        public Builder bracket(BracketSpec bracket) {
            this.bracket = bracket;
            return this;
        }

        public OrderTicket build() {
            return new OrderTicket(orderId, contract, action, orderType, quantity, limitPrice, auxPrice,
                timeInForce, ocaGroup, ocaType, parentId, transmit, account, orderRef, outsideRth,
                goodAfterTime, goodTillDate, trailingPercent, trailStopPrice, whatIf, bracket);
        }
    }
}
