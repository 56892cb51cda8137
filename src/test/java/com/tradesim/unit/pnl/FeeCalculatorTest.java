package com.tradesim.unit.pnl;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradesim.pnl.FeeCalculator;
import java.math.BigDecimal;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class FeeCalculatorTest {

    private final FeeCalculator feeCalculator =
            new FeeCalculator(new BigDecimal("0.001"), new BigDecimal("0.001"), new BigDecimal("0.01"));

    @Test
    @DisplayName("Fee is rate times notional")
    void feeIsRateTimesNotional() {
        assertThat(feeCalculator.entryFee(new BigDecimal("10000"))).isEqualByComparingTo("10.00");
        assertThat(feeCalculator.exitFee(new BigDecimal("11000"))).isEqualByComparingTo("11.00");
    }

    @Test
    @DisplayName("Fees round half-up to the price increment")
    void roundsHalfUpToIncrement() {
        // 0.001 * 1234.5 = 1.2345
        assertThat(feeCalculator.entryFee(new BigDecimal("1234.5"))).isEqualByComparingTo("1.23");
        // 0.001 * 1235 = 1.235
        assertThat(feeCalculator.entryFee(new BigDecimal("1235"))).isEqualByComparingTo("1.24");
        assertThat(feeCalculator.roundToIncrement(new BigDecimal("94.995"))).isEqualByComparingTo("95.00");
    }

    @Test
    @DisplayName("Entry and exit rates are applied independently")
    void asymmetricRates() {
        FeeCalculator makerTaker =
                new FeeCalculator(new BigDecimal("0.0002"), new BigDecimal("0.0004"), new BigDecimal("0.0001"));

        assertThat(makerTaker.entryFee(new BigDecimal("5000"))).isEqualByComparingTo("1.0000");
        assertThat(makerTaker.exitFee(new BigDecimal("5000"))).isEqualByComparingTo("2.0000");
    }

    @Test
    @DisplayName("Zero rate yields zero fee")
    void zeroRate() {
        FeeCalculator free = new FeeCalculator(BigDecimal.ZERO, BigDecimal.ZERO, new BigDecimal("0.01"));

        assertThat(free.entryFee(new BigDecimal("10000"))).isZero();
    }

    @Test
    @DisplayName("Negative rates and non-positive increments are rejected")
    void rejectsInvalidSettings() {
        assertThatThrownBy(() -> new FeeCalculator(new BigDecimal("-0.001"), BigDecimal.ZERO, BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new FeeCalculator(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
