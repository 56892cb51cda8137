package com.tradesim.feed.binance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradesim.config.BinanceConfig;
import com.tradesim.config.HubConfig;
import com.tradesim.domain.model.SubscriptionKey;
import com.tradesim.feed.FeedAdapter;
import com.tradesim.feed.FeedAdapterFactory;
import com.tradesim.feed.ReconnectBackoff;
import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

/** Creates one {@link BinanceFeedAdapter} per subscription key, routed to the spot or futures host. */
@Component
public class BinanceFeedAdapterFactory implements FeedAdapterFactory {

    private final BinanceConfig binanceConfig;
    private final HubConfig hubConfig;
    private final OkHttpClient httpClient;
    private final TaskScheduler feedScheduler;
    private final BinanceMessageParser parser;

    public BinanceFeedAdapterFactory(
            BinanceConfig binanceConfig,
            HubConfig hubConfig,
            OkHttpClient binanceHttpClient,
            @Qualifier("feedScheduler") TaskScheduler feedScheduler,
            ObjectMapper objectMapper) {
        this.binanceConfig = binanceConfig;
        this.hubConfig = hubConfig;
        this.httpClient = binanceHttpClient;
        this.feedScheduler = feedScheduler;
        this.parser = new BinanceMessageParser(objectMapper);
    }

    @Override
    public FeedAdapter create(SubscriptionKey key) {
        String endpoint = BinanceStreams.isFuturesOnly(key.getKind())
                ? binanceConfig.getFuturesWebsocketUrl()
                : binanceConfig.getWebsocketUrl();
        return new BinanceFeedAdapter(
                key,
                endpoint,
                BinanceStreams.streamName(key, hubConfig.getBarInterval()),
                httpClient,
                parser,
                new ReconnectBackoff(hubConfig.getReconnectBase(), hubConfig.getReconnectCap()),
                feedScheduler);
    }
}
