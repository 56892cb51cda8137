package com.tradesim.domain.model;

import com.tradesim.domain.enums.SessionMode;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Immutable configuration a session is created with. Fee rates, price increment and quantity
 * scale default to the engine-wide values from {@code tradesim.engine.*} when left null.
 */
@Value
@Builder(toBuilder = true)
public class SessionConfig {

    String name;

    /** Opaque handle passed back to the signal collaborator. */
    String strategyRef;

    String symbol;

    /** Timeframe handed to the signal collaborator and used for backtest bars, e.g. "1m". */
    @Builder.Default
    String timeframe = "1m";

    @Builder.Default
    SessionMode mode = SessionMode.PAPER;

    BigDecimal initialCapital;

    @Builder.Default
    RiskParameters risk = RiskParameters.none();

    BigDecimal entryFeeRate;
    BigDecimal exitFeeRate;
    BigDecimal priceIncrement;
    Integer quantityScale;

    /** Maximum concurrently open positions. Null means the engine default (1). */
    Integer maxOpenPositions;

    /** Backtest range start, inclusive. Only for BACKTEST sessions. */
    Instant backtestStart;

    /** Backtest range end, exclusive. Only for BACKTEST sessions. */
    Instant backtestEnd;
}
