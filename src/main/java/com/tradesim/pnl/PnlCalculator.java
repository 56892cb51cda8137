package com.tradesim.pnl;

import com.tradesim.domain.enums.PositionSide;
import com.tradesim.domain.model.Position;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;

/**
 * Decimal P&L math shared by live simulation, backtests and equity sampling.
 *
 * <ul>
 *   <li>Long: {@code (price - entry) * qty}</li>
 *   <li>Short: {@code (entry - price) * qty}</li>
 * </ul>
 *
 * <p>All values stay in {@link BigDecimal}; nothing here rounds except
 * {@link #percentOf(BigDecimal, BigDecimal)}.
 */
public final class PnlCalculator {

    private PnlCalculator() {}

    /** Price P&L of closing {@code quantity} units of a position at {@code exitPrice}, before fees. */
    public static BigDecimal grossPnl(PositionSide side, BigDecimal entryPrice, BigDecimal exitPrice, BigDecimal quantity) {
        return exitPrice.subtract(entryPrice).multiply(quantity).multiply(BigDecimal.valueOf(side.direction()));
    }

    /** Unrealized P&L of an open position marked at {@code markPrice}, before exit fees. */
    public static BigDecimal unrealizedPnl(Position position, BigDecimal markPrice) {
        if (markPrice == null) {
            return BigDecimal.ZERO;
        }
        return grossPnl(position.getSide(), position.getEntryPrice(), markPrice, position.getQuantity());
    }

    public static BigDecimal totalUnrealizedPnl(Collection<Position> positions, BigDecimal markPrice) {
        return positions.stream()
                .map(p -> unrealizedPnl(p, markPrice))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** Mark-to-market value of open positions: notional at entry plus unrealized P&L. */
    public static BigDecimal markToMarket(Collection<Position> positions, BigDecimal markPrice) {
        return positions.stream()
                .map(p -> p.getNotionalAtEntry().add(unrealizedPnl(p, markPrice)))
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    /** {@code part / whole * 100} with scale 4; zero when {@code whole} is zero. */
    public static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole.signum() == 0) {
            return BigDecimal.ZERO;
        }
        return part.multiply(BigDecimal.valueOf(100)).divide(whole, 4, RoundingMode.HALF_UP);
    }
}
