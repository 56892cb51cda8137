package com.tradesim.pnl;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Computes trading fees for simulated fills.
 *
 * <p>Fee = {@code rate * notional}, rounded half-up to the instrument's minimum price increment.
 * Entry and exit use separate rates so asymmetric maker/taker schedules can be modelled; the
 * engine defaults both to the same commission rate.
 *
 * <p>Stateless and immutable: one instance per session, built from that session's fee
 * settings.
 */
public class FeeCalculator {

    private final BigDecimal entryRate;
    private final BigDecimal exitRate;
    private final BigDecimal increment;

    public FeeCalculator(BigDecimal entryRate, BigDecimal exitRate, BigDecimal increment) {
        if (entryRate.signum() < 0 || exitRate.signum() < 0) {
            throw new IllegalArgumentException("Fee rates must not be negative");
        }
        if (increment.signum() <= 0) {
            throw new IllegalArgumentException("Price increment must be positive");
        }
        this.entryRate = entryRate;
        this.exitRate = exitRate;
        this.increment = increment;
    }

    public BigDecimal entryFee(BigDecimal notional) {
        return roundToIncrement(notional.multiply(entryRate));
    }

    public BigDecimal exitFee(BigDecimal notional) {
        return roundToIncrement(notional.multiply(exitRate));
    }

    /** Rounds half-up to the nearest multiple of the price increment. */
    public BigDecimal roundToIncrement(BigDecimal value) {
        return value.divide(increment, 0, RoundingMode.HALF_UP).multiply(increment);
    }

    public BigDecimal getEntryRate() {
        return entryRate;
    }

    public BigDecimal getExitRate() {
        return exitRate;
    }

    public BigDecimal getIncrement() {
        return increment;
    }
}
