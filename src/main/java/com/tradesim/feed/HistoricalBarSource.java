package com.tradesim.feed;

import com.tradesim.domain.model.PriceBar;
import java.time.Instant;
import java.util.List;

/**
 * External collaborator that supplies historical bars for backtests. Fetching, caching and
 * retrying are its own concern.
 */
@FunctionalInterface
public interface HistoricalBarSource {

    /**
     * Returns the bars of {@code symbol} whose open time lies in {@code [start, end)}, oldest first.
     */
    List<PriceBar> getBars(String symbol, String timeframe, Instant start, Instant end);
}
