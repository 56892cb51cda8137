package com.tradesim.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Stream hub and feed adapter settings, bound to {@code tradesim.hub.*}.
 */
@Configuration
@ConfigurationProperties(prefix = "tradesim.hub")
@Getter
@Setter
public class HubConfig {

    /** Capacity of each subscriber's delivery channel. Full channels evict their oldest event. */
    private int channelCapacity = 256;

    /** First reconnect delay ceiling. */
    private Duration reconnectBase = Duration.ofSeconds(1);

    /** Upper bound of the reconnect delay ceiling. */
    private Duration reconnectCap = Duration.ofSeconds(30);

    /** Kline interval used for BAR_CLOSE streams. */
    private String barInterval = "1m";
}
