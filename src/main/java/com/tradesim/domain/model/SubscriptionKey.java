package com.tradesim.domain.model;

import com.tradesim.domain.enums.EventKind;
import java.util.Locale;
import java.util.Objects;
import lombok.Value;

/**
 * Identifies one upstream stream: a symbol and an event kind. Symbols are normalized to upper
 * case so {@code btcusdt} and {@code BTCUSDT} share one adapter.
 */
@Value
public class SubscriptionKey {

    String symbol;
    EventKind kind;

    public SubscriptionKey(String symbol, EventKind kind) {
        this.symbol = Objects.requireNonNull(symbol, "symbol").trim().toUpperCase(Locale.ROOT);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    @Override
    public String toString() {
        return symbol + "/" + kind;
    }
}
