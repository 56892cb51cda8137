package com.tradesim.hub;

import com.tradesim.domain.model.SubscriptionKey;
import lombok.Value;

/**
 * Handle returned by {@link StreamHub#subscribe}. The subscriber reads from {@link #getChannel()}
 * and releases the stream with {@link StreamHub#unsubscribe(String)}; closing the channel
 * directly also releases it on the next fan-out.
 */
@Value
public class Subscription {

    String id;
    SubscriptionKey key;
    DeliveryChannel channel;

    public long droppedCount() {
        return channel.droppedCount();
    }
}
