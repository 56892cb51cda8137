package com.tradesim.domain.model;

import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/** OHLCV bar supplied by the historical data collaborator for backtests. */
@Value
@Builder
public class PriceBar {

    String symbol;
    Instant openTime;
    Instant closeTime;
    BigDecimal open;
    BigDecimal high;
    BigDecimal low;
    BigDecimal close;
    BigDecimal volume;
}
