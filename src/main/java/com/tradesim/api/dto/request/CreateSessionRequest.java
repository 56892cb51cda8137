package com.tradesim.api.dto.request;

import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionConfig;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.math.BigDecimal;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Request payload for starting a PAPER or LIVE session.
 *
 * <p>Risk percentages are optional and range over (0, 100]. Fee rates, price increment,
 * quantity scale and position limit fall back to the engine defaults when omitted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateSessionRequest {

    private String name;

    /** Opaque strategy handle forwarded to the signal provider. */
    private String strategyRef;

    @NotBlank
    private String symbol;

    /** Signal timeframe, e.g. "1m". Default "1m". */
    private String timeframe;

    /** PAPER (default) or LIVE. */
    private SessionMode mode;

    @NotNull
    @Positive
    private BigDecimal initialCapital;

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
                .mode(mode != null ? mode : SessionMode.PAPER)
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
                .build();
    }
}
