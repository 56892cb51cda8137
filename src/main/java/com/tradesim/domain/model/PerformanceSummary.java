package com.tradesim.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** Trade statistics of a session, derived from its trade log and equity curve. */
@Value
@Builder
public class PerformanceSummary {

    int totalTrades;
    int winningTrades;
    int losingTrades;

    /** Winning trades over all trades, in percent. */
    BigDecimal winRatePercent;

    BigDecimal averageWin;
    BigDecimal averageLoss;

    /** Gross wins over gross losses; null when there were no losing trades. */
    BigDecimal profitFactor;

    BigDecimal totalReturnPercent;

    /** Largest peak-to-trough fall of the equity curve, in percent of the peak. */
    BigDecimal maxDrawdownPercent;

    BigDecimal peakEquity;
    BigDecimal lowestEquity;
    BigDecimal finalEquity;
}
