package com.tradesim.engine;

import com.tradesim.domain.enums.Signal;

/**
 * Strategy signal collaborator. A pure query: the engine calls it once per processed event and
 * never relies on side effects. Implementations must be thread-safe; many sessions share one.
 */
@FunctionalInterface
public interface SignalProvider {

    Signal getSignal(String symbol, String timeframe);
}
