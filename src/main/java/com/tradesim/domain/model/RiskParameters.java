package com.tradesim.domain.model;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * Per-session risk settings, all expressed in percent (5 = 5%). Every field is optional:
 * null stop-loss or take-profit disables that trigger, null max position size means 100%.
 */
@Value
@Builder
public class RiskParameters {

    BigDecimal stopLossPercent;
    BigDecimal takeProfitPercent;
    BigDecimal maxPositionSizePercent;

    public static RiskParameters none() {
        return RiskParameters.builder().build();
    }
}
