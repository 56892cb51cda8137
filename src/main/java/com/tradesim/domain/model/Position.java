package com.tradesim.domain.model;

import com.tradesim.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * An open simulated position. Immutable: entry terms and the stop/target prices are frozen at
 * entry and never change for the life of the position. Closing it produces a {@link ClosedTrade}.
 */
@Value
@Builder
public class Position {

    String id;
    String symbol;
    PositionSide side;
    BigDecimal entryPrice;
    BigDecimal quantity;
    Instant entryTime;

    /** entryPrice * quantity, the cash allocated to this position. */
    BigDecimal notionalAtEntry;

    /** Fee already deducted from cash when the position was opened. */
    BigDecimal entryFee;

    /** Null when the session has no stop-loss. */
    BigDecimal stopLossPrice;

    /** Null when the session has no take-profit. */
    BigDecimal takeProfitPrice;

    /** Cash plus fee locked by this position; what capital conservation counts for it. */
    public BigDecimal allocatedCapital() {
        return notionalAtEntry.add(entryFee);
    }

    public boolean isStopLossBreached(BigDecimal price) {
        if (stopLossPrice == null) {
            return false;
        }
        return side == PositionSide.LONG ? price.compareTo(stopLossPrice) <= 0 : price.compareTo(stopLossPrice) >= 0;
    }

    public boolean isTakeProfitBreached(BigDecimal price) {
        if (takeProfitPrice == null) {
            return false;
        }
        return side == PositionSide.LONG
                ? price.compareTo(takeProfitPrice) >= 0
                : price.compareTo(takeProfitPrice) <= 0;
    }
}
