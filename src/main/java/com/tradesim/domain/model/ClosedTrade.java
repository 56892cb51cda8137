package com.tradesim.domain.model;

import com.tradesim.domain.enums.ExitReason;
import com.tradesim.domain.enums.PositionSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** Immutable record of a completed position. Appended to the session's trade log, never changed. */
@Value
@Builder
public class ClosedTrade {

    String positionId;
    String symbol;
    PositionSide side;
    BigDecimal entryPrice;
    BigDecimal quantity;
    Instant entryTime;
    BigDecimal notionalAtEntry;
    BigDecimal exitPrice;
    Instant exitTime;
    ExitReason exitReason;

    /** Price P&L minus entry and exit fees. */
    BigDecimal realizedPnl;

    /** Entry fee plus exit fee. */
    BigDecimal feesPaid;

    /** realizedPnl / notionalAtEntry * 100, scale 4. */
    BigDecimal pnlPercent;

    public boolean isWin() {
        return realizedPnl.signum() > 0;
    }
}
