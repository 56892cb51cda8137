package com.tradesim.config;

import com.tradesim.domain.enums.Signal;
import com.tradesim.engine.SignalProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Fallback strategy signal source. Strategy logic is supplied by the host application as a
 * {@link SignalProvider} bean; without one every session stays flat.
 */
@Configuration
public class SignalConfig {

    private static final Logger log = LoggerFactory.getLogger(SignalConfig.class);

    @Bean
    @ConditionalOnMissingBean(SignalProvider.class)
    public SignalProvider neutralSignalProvider() {
        log.warn("No SignalProvider bean found, sessions will receive NEUTRAL signals only");
        return (symbol, timeframe) -> Signal.NEUTRAL;
    }
}
