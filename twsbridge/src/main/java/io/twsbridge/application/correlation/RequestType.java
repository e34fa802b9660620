package io.twsbridge.application.correlation;

import io.twsbridge.domain.event.AccountDownloadEndEvent;
import io.twsbridge.domain.event.AccountUpdateTimeEvent;
import io.twsbridge.domain.event.AccountValueEvent;
import io.twsbridge.domain.event.ContractDetailsEndEvent;
import io.twsbridge.domain.event.CurrentTimeEvent;
import io.twsbridge.domain.event.ExecDetailsEndEvent;
import io.twsbridge.domain.event.HistoricalDataEvent;
import io.twsbridge.domain.event.InboundEvent;
import io.twsbridge.domain.event.OpenOrderEndEvent;
import io.twsbridge.domain.event.OpenOrderEvent;
import io.twsbridge.domain.event.OrderStatusEvent;
import io.twsbridge.domain.event.PortfolioValueEvent;
import io.twsbridge.domain.event.PositionEndEvent;
import io.twsbridge.domain.event.PositionEvent;
import io.twsbridge.domain.event.TickSnapshotEndEvent;

/**
 * What a pending request is waiting for.
 *
 * Channel types get replies that carry no id on the wire; they are matched
 * first-in first-out among requests of the same type.
 */
public enum RequestType {
    ORDER(false),
    SNAPSHOT(false),
    EXECUTIONS(false),
    OPEN_ORDERS(true),
    POSITIONS(true),
    CURRENT_TIME(true),
    ACCOUNT(true),
    HISTORICAL_DATA(false),
    CONTRACT_DETAILS(false),
    MARKET_DATA(false),
    REAL_TIME_BARS(false);

    private final boolean channel;

    RequestType(boolean channel) {
        this.channel = channel;
    }

    public boolean isChannel() {
        return channel;
    }

    /**
     * @return true if the event ends a request of this type
     */
    public boolean isTerminal(InboundEvent event) {
        return switch (this) {
            case ORDER -> event instanceof OrderStatusEvent && ((OrderStatusEvent) event).isTerminal();
            case SNAPSHOT -> event instanceof TickSnapshotEndEvent;
            case EXECUTIONS -> event instanceof ExecDetailsEndEvent;
            case OPEN_ORDERS -> event instanceof OpenOrderEndEvent;
            case POSITIONS -> event instanceof PositionEndEvent;
            case CURRENT_TIME -> event instanceof CurrentTimeEvent;
            case ACCOUNT -> event instanceof AccountDownloadEndEvent;
            case HISTORICAL_DATA -> event instanceof HistoricalDataEvent;
            case CONTRACT_DETAILS -> event instanceof ContractDetailsEndEvent;
            case MARKET_DATA, REAL_TIME_BARS -> false;
        };
    }

    /**
     * @return the channel an id-less reply belongs to, or null
     */
    public static RequestType channelOf(InboundEvent event) {
        if (event instanceof CurrentTimeEvent) {
            return CURRENT_TIME;
        }
        if (event instanceof OpenOrderEvent || event instanceof OpenOrderEndEvent) {
            return OPEN_ORDERS;
        }
        if (event instanceof PositionEvent || event instanceof PositionEndEvent) {
            return POSITIONS;
        }
        if (event instanceof AccountValueEvent || event instanceof PortfolioValueEvent
            || event instanceof AccountUpdateTimeEvent || event instanceof AccountDownloadEndEvent) {
            return ACCOUNT;
        }
        return null;
    }
}
