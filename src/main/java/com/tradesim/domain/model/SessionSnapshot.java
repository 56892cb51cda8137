package com.tradesim.domain.model;

import com.tradesim.domain.enums.SessionStatus;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable copy of a session's durable record, pushed to the session store after every state
 * transition. Lists are copied on construction so a reader can never observe a torn update.
 */
@Value
@Builder(toBuilder = true)
public class SessionSnapshot {

    String id;
    SessionConfig config;
    SessionStatus status;
    BigDecimal initialCapital;
    BigDecimal currentCapital;
    List<Position> openPositions;
    List<ClosedTrade> closedTrades;
    List<EquityPoint> equityCurve;

    /** Last accepted price for the session's symbol, null before the first event. */
    BigDecimal lastPrice;

    /** Exchange timestamp of the last processed event. */
    Instant lastEventAt;

    /** Wall-clock time the last event was processed; drives the staleness metric. */
    Instant lastProcessedAt;

    long processedEvents;
    long discardedEvents;
    Instant createdAt;
    Instant stoppedAt;
    String stopReason;

    public static class SessionSnapshotBuilder {

        public SessionSnapshotBuilder openPositions(List<Position> openPositions) {
            this.openPositions = openPositions == null ? List.of() : List.copyOf(openPositions);
            return this;
        }

        public SessionSnapshotBuilder closedTrades(List<ClosedTrade> closedTrades) {
            this.closedTrades = closedTrades == null ? List.of() : List.copyOf(closedTrades);
            return this;
        }

        public SessionSnapshotBuilder equityCurve(List<EquityPoint> equityCurve) {
            this.equityCurve = equityCurve == null ? List.of() : List.copyOf(equityCurve);
            return this;
        }
    }

    public BigDecimal getRealizedPnl() {
        return closedTrades.stream().map(ClosedTrade::getRealizedPnl).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public BigDecimal getTotalFees() {
        return closedTrades.stream().map(ClosedTrade::getFeesPaid).reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    public long getWinningTrades() {
        return closedTrades.stream().filter(ClosedTrade::isWin).count();
    }

    /** Realized return on initial capital in percent, scale 4. */
    public BigDecimal getTotalReturnPercent() {
        return getRealizedPnl().multiply(BigDecimal.valueOf(100)).divide(initialCapital, 4, RoundingMode.HALF_UP);
    }
}
