package com.tradesim.pnl;

import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.PerformanceSummary;
import com.tradesim.domain.model.SessionSnapshot;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Summarizes a session's results. A trade with zero or negative realized P&L counts as a loss.
 * Sessions without equity samples report their current capital as peak, low and final equity.
 */
public final class PerformanceCalculator {

    private static final int SCALE = 4;

    private PerformanceCalculator() {}

    public static PerformanceSummary summarize(SessionSnapshot snapshot) {
        List<ClosedTrade> trades = snapshot.getClosedTrades();
        List<BigDecimal> wins = trades.stream().filter(ClosedTrade::isWin).map(ClosedTrade::getRealizedPnl).toList();
        List<BigDecimal> losses = trades.stream()
                .filter(trade -> !trade.isWin())
                .map(ClosedTrade::getRealizedPnl)
                .toList();

        BigDecimal grossWin = sum(wins);
        BigDecimal grossLoss = sum(losses).abs();

        List<BigDecimal> equity = snapshot.getEquityCurve().stream().map(EquityPoint::getEquity).toList();
        BigDecimal fallback = snapshot.getCurrentCapital();

        return PerformanceSummary.builder()
                .totalTrades(trades.size())
                .winningTrades(wins.size())
                .losingTrades(losses.size())
                .winRatePercent(PnlCalculator.percentOf(BigDecimal.valueOf(wins.size()), BigDecimal.valueOf(trades.size())))
                .averageWin(average(wins))
                .averageLoss(average(losses))
                .profitFactor(grossLoss.signum() == 0 ? null : grossWin.divide(grossLoss, SCALE, RoundingMode.HALF_UP))
                .totalReturnPercent(snapshot.getTotalReturnPercent())
                .maxDrawdownPercent(maxDrawdownPercent(equity))
                .peakEquity(equity.stream().max(BigDecimal::compareTo).orElse(fallback))
                .lowestEquity(equity.stream().min(BigDecimal::compareTo).orElse(fallback))
                .finalEquity(equity.isEmpty() ? fallback : equity.get(equity.size() - 1))
                .build();
    }

    /** Largest fall from a running peak, as a positive percentage of that peak. */
    public static BigDecimal maxDrawdownPercent(List<BigDecimal> equityCurve) {
        BigDecimal peak = null;
        BigDecimal worst = BigDecimal.ZERO;
        for (BigDecimal value : equityCurve) {
            if (peak == null || value.compareTo(peak) > 0) {
                peak = value;
            }
            if (peak.signum() > 0) {
                BigDecimal drawdown = PnlCalculator.percentOf(peak.subtract(value), peak);
                if (drawdown.compareTo(worst) > 0) {
                    worst = drawdown;
                }
            }
        }
        return worst.setScale(SCALE, RoundingMode.HALF_UP);
    }

    private static BigDecimal sum(List<BigDecimal> values) {
        return values.stream().reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    private static BigDecimal average(List<BigDecimal> values) {
        if (values.isEmpty()) {
            return BigDecimal.ZERO;
        }
        return sum(values).divide(BigDecimal.valueOf(values.size()), SCALE, RoundingMode.HALF_UP);
    }
}
