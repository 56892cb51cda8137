package com.tradesim.feed;

import com.tradesim.domain.model.MarketEvent;

/**
 * Receives events emitted by a feed adapter. Implementations must not block: the adapter calls
 * this on its transport thread.
 */
@FunctionalInterface
public interface MarketEventSink {

    void onEvent(MarketEvent event);
}
