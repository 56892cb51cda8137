package com.tradesim.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.enums.SessionStatus;
import com.tradesim.domain.model.ClosedTrade;
import com.tradesim.domain.model.EquityPoint;
import com.tradesim.domain.model.PerformanceSummary;
import com.tradesim.domain.model.Position;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionSnapshot;
import com.tradesim.pnl.PerformanceCalculator;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * API view of a session. The list endpoint returns the summary form; the detail endpoint also
 * carries the trade log and equity curve.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SessionResponse {

    String id;
    String name;
    String strategyRef;
    String symbol;
    String timeframe;
    SessionMode mode;
    SessionStatus status;
    RiskParameters risk;
    BigDecimal initialCapital;
    BigDecimal currentCapital;
    BigDecimal realizedPnl;
    BigDecimal totalFees;
    BigDecimal totalReturnPercent;
    BigDecimal lastPrice;
    Instant lastEventAt;
    long processedEvents;
    long discardedEvents;
    List<Position> openPositions;
    PerformanceSummary performance;
    Instant createdAt;
    Instant stoppedAt;
    String stopReason;
    Instant backtestStart;
    Instant backtestEnd;

    /** Detail view only. */
    List<ClosedTrade> closedTrades;

    /** Detail view only. */
    List<EquityPoint> equityCurve;

    public static SessionResponse summary(SessionSnapshot snapshot) {
        return base(snapshot).build();
    }

    public static SessionResponse detail(SessionSnapshot snapshot) {
        return base(snapshot)
                .closedTrades(snapshot.getClosedTrades())
                .equityCurve(snapshot.getEquityCurve())
                .build();
    }

    private static SessionResponseBuilder base(SessionSnapshot snapshot) {
        return SessionResponse.builder()
                .id(snapshot.getId())
                .name(snapshot.getConfig().getName())
                .strategyRef(snapshot.getConfig().getStrategyRef())
                .symbol(snapshot.getConfig().getSymbol())
                .timeframe(snapshot.getConfig().getTimeframe())
                .mode(snapshot.getConfig().getMode())
                .status(snapshot.getStatus())
                .risk(snapshot.getConfig().getRisk())
                .initialCapital(snapshot.getInitialCapital())
                .currentCapital(snapshot.getCurrentCapital())
                .realizedPnl(snapshot.getRealizedPnl())
                .totalFees(snapshot.getTotalFees())
                .totalReturnPercent(snapshot.getTotalReturnPercent())
                .lastPrice(snapshot.getLastPrice())
                .lastEventAt(snapshot.getLastEventAt())
                .processedEvents(snapshot.getProcessedEvents())
                .discardedEvents(snapshot.getDiscardedEvents())
                .openPositions(snapshot.getOpenPositions())
                .performance(PerformanceCalculator.summarize(snapshot))
                .createdAt(snapshot.getCreatedAt())
                .stoppedAt(snapshot.getStoppedAt())
                .stopReason(snapshot.getStopReason())
                .backtestStart(snapshot.getConfig().getBacktestStart())
                .backtestEnd(snapshot.getConfig().getBacktestEnd());
    }
}
