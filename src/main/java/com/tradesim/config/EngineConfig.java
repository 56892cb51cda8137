package com.tradesim.config;

import java.math.BigDecimal;
import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Engine-wide defaults for simulated sessions.
 *
 * <p>Binds to {@code tradesim.engine.*}. A session config may override the fee rates, price
 * increment, quantity scale and open-position limit; anything it leaves null falls back here.
 */
@Configuration
@ConfigurationProperties(prefix = "tradesim.engine")
@Getter
@Setter
public class EngineConfig {

    /** Commission charged on entry fills, as a fraction of notional (0.001 = 0.1%). */
    private BigDecimal entryFeeRate = new BigDecimal("0.001");

    /** Commission charged on exit fills. Defaults to the same rate as entry. */
    private BigDecimal exitFeeRate = new BigDecimal("0.001");

    /** Minimum price increment; fees and stop/target prices are rounded to it. */
    private BigDecimal priceIncrement = new BigDecimal("0.01");

    /** Decimal places of position quantities. Sizing rounds down to this scale. */
    private int quantityScale = 8;

    private int maxOpenPositions = 1;

    /** Equity curve sampling cadence, measured in event time. */
    private Duration equitySampleInterval = Duration.ofSeconds(60);

    /** When true, FUNDING_RATE mark prices revalue open positions for equity samples. */
    private boolean fundingMarkToMarket = false;

    /** How long a session worker waits on its channel before re-checking its state. */
    private Duration workerPollTimeout = Duration.ofMillis(500);

    /** Sessions with no processed event for longer than this are reported as stale. */
    private Duration staleAfter = Duration.ofMinutes(2);
}
