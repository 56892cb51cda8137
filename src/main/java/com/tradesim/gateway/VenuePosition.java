package com.tradesim.gateway;

import com.tradesim.domain.enums.PositionSide;
import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/** A position as the venue reports it. Spot venues derive these from non-quote balances. */
@Value
@Builder
public class VenuePosition {

    String symbol;
    PositionSide side;
    BigDecimal quantity;

    /** Null when the venue does not report an entry price. */
    BigDecimal entryPrice;
}
