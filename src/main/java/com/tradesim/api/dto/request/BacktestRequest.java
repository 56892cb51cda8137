package com.tradesim.api.dto.request;

import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request payload for a backtest over {@code [start, end)} of historical bars. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BacktestRequest {

    private String name;

    private String strategyRef;

    @NotBlank
    private String symbol;

    /** Bar timeframe, e.g. "1h". Default "1m". */
    private String timeframe;

    @NotNull
    @Positive
    private BigDecimal initialCapital;

    @NotNull
    private Instant start;

    @NotNull
    private Instant end;

    private BigDecimal stopLossPercent;
    private BigDecimal takeProfitPercent;
    private BigDecimal maxPositionSizePercent;

    private BigDecimal entryFeeRate;
    private BigDecimal exitFeeRate;
    private BigDecimal priceIncrement;
    private Integer quantityScale;
    private Integer maxOpenPositions;

    public SessionConfig toConfig() {
        return SessionConfig.builder()
                .name(name)
                .strategyRef(strategyRef)
                .symbol(symbol)
                .timeframe(timeframe)
                .mode(SessionMode.BACKTEST)
                .initialCapital(initialCapital)
                .risk(RiskParameters.builder()
                        .stopLossPercent(stopLossPercent)
                        .takeProfitPercent(takeProfitPercent)
                        .maxPositionSizePercent(maxPositionSizePercent)
                        .build())
                .entryFeeRate(entryFeeRate)
                .exitFeeRate(exitFeeRate)
                .priceIncrement(priceIncrement)
                .quantityScale(quantityScale)
                .maxOpenPositions(maxOpenPositions)
                .backtestStart(start)
                .backtestEnd(end)
                .build();
    }
}
