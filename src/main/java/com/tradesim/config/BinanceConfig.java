package com.tradesim.config;

import java.time.Duration;
import java.util.concurrent.TimeUnit;
import lombok.Getter;
import lombok.Setter;
import okhttp3.OkHttpClient;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Binance endpoints and credentials, bound to {@code tradesim.binance.*}, plus the shared
 * {@link OkHttpClient} used by the feed adapter and the execution gateway.
 *
 * <p>Credentials are read from the environment ({@code BINANCE_API_KEY},
 * {@code BINANCE_API_SECRET}) through application.properties placeholders. They are only
 * needed for live sessions; market data streams are public.
 */
@Configuration
@ConfigurationProperties(prefix = "tradesim.binance")
@Getter
@Setter
public class BinanceConfig {

    /** Raw stream endpoint. Futures-only kinds (funding, liquidations) need the fstream host. */
    private String websocketUrl = "wss://stream.binance.com:9443/ws";

    private String futuresWebsocketUrl = "wss://fstream.binance.com/ws";

    private String restUrl = "https://api.binance.com";

    private String apiKey;

    private String apiSecret;

    /** Quote asset stripped when deriving venue positions from balances. */
    private String quoteAsset = "USDT";

    private long recvWindowMs = 5000;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration readTimeout = Duration.ofSeconds(10);

    /** WebSocket ping interval; a missed pong fails the socket and triggers reconnect. */
    private Duration pingInterval = Duration.ofSeconds(20);

    @Bean
    public OkHttpClient binanceHttpClient() {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .pingInterval(pingInterval.toMillis(), TimeUnit.MILLISECONDS)
                .build();
    }

    public boolean hasCredentials() {
        return apiKey != null && !apiKey.isBlank() && apiSecret != null && !apiSecret.isBlank();
    }
}
