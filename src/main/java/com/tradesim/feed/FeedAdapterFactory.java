package com.tradesim.feed;

import com.tradesim.domain.model.SubscriptionKey;

/** Creates feed adapters for the stream hub. Each call returns a new, unconnected adapter. */
@FunctionalInterface
public interface FeedAdapterFactory {

    FeedAdapter create(SubscriptionKey key);
}
