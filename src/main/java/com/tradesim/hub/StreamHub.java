package com.tradesim.hub;

import com.tradesim.config.HubConfig;
import com.tradesim.domain.enums.EventKind;
import com.tradesim.domain.model.MarketEvent;
import com.tradesim.domain.model.SubscriptionKey;
import com.tradesim.exception.FeedConnectionException;
import com.tradesim.feed.FeedAdapter;
import com.tradesim.feed.FeedAdapterFactory;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Fans out market data from one upstream adapter per (symbol, kind) to any number of subscribers.
 *
 * <p>The first subscriber of a key creates and connects its adapter; the last one to leave
 * closes it. Both transitions run inside {@link ConcurrentHashMap#compute} for the key, so a
 * burst of concurrent subscribes creates exactly one adapter and a subscribe racing the last
 * unsubscribe either joins the old group or starts a fresh one, never a closed one.
 *
 * <p>Each subscriber gets its own bounded {@link DeliveryChannel}. Fan-out only ever offers to
 * those channels, so a slow subscriber drops its own oldest events and the adapter thread never
 * waits. A subscriber whose channel was closed is released on the next event for its key.
 */
@Service
public class StreamHub {

    private static final Logger log = LoggerFactory.getLogger(StreamHub.class);

    private final FeedAdapterFactory adapterFactory;
    private final int channelCapacity;

    private final Map<SubscriptionKey, FeedGroup> groups = new ConcurrentHashMap<>();
    private final Map<String, Subscription> subscriptions = new ConcurrentHashMap<>();
    private final AtomicLong droppedEvents = new AtomicLong();
    private final AtomicLong deliveredEvents = new AtomicLong();

    private volatile boolean shutdown;

    public StreamHub(FeedAdapterFactory adapterFactory, HubConfig hubConfig) {
        this.adapterFactory = adapterFactory;
        this.channelCapacity = hubConfig.getChannelCapacity();
    }

    /**
     * Subscribes to a stream. Upstream connection failures are not reported here: the adapter
     * retries on its own and the subscriber simply sees no events until it succeeds.
     *
     * @throws IllegalStateException if the hub has been shut down
     */
    public Subscription subscribe(String symbol, EventKind kind) {
        if (shutdown) {
            throw new IllegalStateException("Stream hub is shut down");
        }
        SubscriptionKey key = new SubscriptionKey(symbol, kind);
        DeliveryChannel channel = new DeliveryChannel(channelCapacity, droppedEvents::incrementAndGet);
        Subscription subscription = new Subscription(UUID.randomUUID().toString(), key, channel);

        groups.compute(key, (k, group) -> {
            if (group == null) {
                group = new FeedGroup(adapterFactory.create(k));
                group.start();
            }
            group.subscribers.add(subscription);
            subscriptions.put(subscription.getId(), subscription);
            return group;
        });

        log.debug("Subscribed {} to {}", subscription.getId(), key);
        return subscription;
    }

    /**
     * Releases a subscription and closes its channel. Closes the upstream adapter when this was
     * the last subscriber of the key. Unknown or already released ids are ignored.
     */
    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptions.remove(subscriptionId);
        if (subscription == null) {
            return;
        }
        subscription.getChannel().close();

        groups.computeIfPresent(subscription.getKey(), (k, group) -> {
            group.subscribers.remove(subscription);
            if (group.subscribers.isEmpty()) {
                group.adapter.close();
                log.info("Last subscriber left {}, upstream closed", k);
                return null;
            }
            return group;
        });

        if (subscription.droppedCount() > 0) {
            log.info("Subscription {} on {} released after dropping {} events",
                    subscriptionId, subscription.getKey(), subscription.droppedCount());
        }
    }

    /** Closes every adapter and every channel. Subscribers drain what is buffered and stop. */
    public void shutdown() {
        shutdown = true;
        List<String> ids = List.copyOf(subscriptions.keySet());
        ids.forEach(this::unsubscribe);
        // groups left by a subscribe that raced the shutdown
        groups.keySet().forEach(key -> groups.computeIfPresent(key, (k, group) -> {
            group.adapter.close();
            group.subscribers.forEach(s -> s.getChannel().close());
            return null;
        }));
        log.info("Stream hub shut down, released {} subscriptions", ids.size());
    }

    public int activeAdapterCount() {
        return groups.size();
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    public int subscriberCount(String symbol, EventKind kind) {
        FeedGroup group = groups.get(new SubscriptionKey(symbol, kind));
        return group == null ? 0 : group.subscribers.size();
    }

    public boolean isUpstreamConnected(String symbol, EventKind kind) {
        FeedGroup group = groups.get(new SubscriptionKey(symbol, kind));
        return group != null && group.adapter.isConnected();
    }

    /** Events evicted from full channels across all subscribers since startup. */
    public long totalDroppedEvents() {
        return droppedEvents.get();
    }

    public long totalDeliveredEvents() {
        return deliveredEvents.get();
    }

    /** One upstream adapter and the subscribers sharing it. */
    private final class FeedGroup {

        private final FeedAdapter adapter;
        private final List<Subscription> subscribers = new CopyOnWriteArrayList<>();

        private FeedGroup(FeedAdapter adapter) {
            this.adapter = adapter;
        }

        private void start() {
            try {
                adapter.connect(this::publish);
            } catch (FeedConnectionException e) {
                log.error("Upstream for {} could not be started: {}", adapter.key(), e.getMessage());
            }
        }

        private void publish(MarketEvent event) {
            for (Subscription subscription : subscribers) {
                if (subscription.getChannel().offer(event)) {
                    deliveredEvents.incrementAndGet();
                } else {
                    unsubscribe(subscription.getId());
                }
            }
        }
    }
}
