package com.tradesim.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** One sample of a session's equity curve. */
@Value
@Builder
public class EquityPoint {

    Instant timestamp;

    /** cash + allocated capital + unrealized P&L of open positions. */
    BigDecimal equity;

    BigDecimal cash;
    BigDecimal unrealizedPnl;
    int openPositions;
}
