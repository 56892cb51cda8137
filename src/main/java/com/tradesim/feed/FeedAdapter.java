package com.tradesim.feed;

import com.tradesim.domain.model.SubscriptionKey;
import com.tradesim.exception.FeedConnectionException;

/**
 * Normalizes one exchange-specific real-time stream into {@link com.tradesim.domain.model.MarketEvent}s.
 * One instance per (exchange, symbol, kind).
 *
 * <p>Contract:
 * <ul>
 *   <li>{@link #connect(MarketEventSink)} starts the connection and returns without waiting for
 *       the first message. It throws {@link FeedConnectionException} only for failures that make
 *       the adapter unusable (closed adapter, invalid endpoint).</li>
 *   <li>Transport failures after that are retried internally with backoff. Callers see nothing
 *       but a gap in events.</li>
 *   <li>Events reach the sink in exchange order with no duplicates for the adapter's key.</li>
 *   <li>{@link #close()} is idempotent and stops all reconnect attempts.</li>
 * </ul>
 */
public interface FeedAdapter {

    SubscriptionKey key();

    /**
     * Starts streaming into {@code sink}.
     *
     * @throws FeedConnectionException if the adapter cannot be started at all
     */
    void connect(MarketEventSink sink);

    void close();

    boolean isConnected();

    /** Number of successful reconnects since {@link #connect(MarketEventSink)}. */
    long reconnectCount();
}
