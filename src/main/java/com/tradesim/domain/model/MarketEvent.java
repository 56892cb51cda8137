package com.tradesim.domain.model;

import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.time.Instant;
import lombok.Builder;
import lombok.Value;

/**
 * Canonical market data event produced by a feed adapter.
 *
 * <p>Immutable: the hub hands the same instance to every subscriber of a {@code (symbol, kind)}
 * stream, so no consumer can alter what another one sees.
 *
 * <p>{@code quantity}, {@code side}, {@code sequence} and {@code fundingRate} are optional and
 * depend on the kind. {@code timestamp} is the exchange-reported time and is monotonic per
 * symbol and kind once the event leaves the adapter.
 */
@Value
@Builder(toBuilder = true)
public class MarketEvent {

    String symbol;
    EventKind kind;
    Instant timestamp;
    BigDecimal price;

    /** Traded or liquidated quantity. Null for funding rate events. */
    BigDecimal quantity;

    /** Aggressor side. Null when the exchange does not report one. */
    TradeSide side;

    /** Exchange sequence id (trade id, aggregate trade id). Null when unavailable. */
    Long sequence;

    /** Funding rate per interval, only on FUNDING_RATE events. */
    BigDecimal fundingRate;

    public SubscriptionKey key() {
        return new SubscriptionKey(symbol, kind);
    }

    /** True when the event carries the minimum a session needs to act on it. */
    public boolean isWellFormed() {
        return symbol != null
                && kind != null
                && timestamp != null
                && price != null
                && price.signum() > 0
                && (quantity == null || quantity.signum() >= 0);
    }
}
