package com.tradesim.unit.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.tradesim.config.EngineConfig;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.engine.SessionConfigValidator;
import com.tradesim.exception.ValidationException;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class SessionConfigValidatorTest {

    private EngineConfig engineConfig;
    private SessionConfigValidator validator;

    @BeforeEach
    void setUp() {
        engineConfig = new EngineConfig();
        engineConfig.setQuantityScale(6);
        validator = new SessionConfigValidator(engineConfig);
    }

    private SessionConfig.SessionConfigBuilder valid() {
        return SessionConfig.builder().symbol(" btcusdt ").initialCapital(new BigDecimal("1000"));
    }

    @SuppressWarnings("unchecked")
    private static List<String> errorsOf(ValidationException e) {
        return (List<String>) e.getDetails().get("errors");
    }

    @Test
    @DisplayName("Fills engine defaults and normalizes the symbol")
    void resolvesDefaults() {
        SessionConfig resolved = validator.validateAndResolve(valid().timeframe(null).risk(null).mode(null).build());

        assertThat(resolved.getSymbol()).isEqualTo("BTCUSDT");
        assertThat(resolved.getTimeframe()).isEqualTo("1m");
        assertThat(resolved.getMode()).isEqualTo(SessionMode.PAPER);
        assertThat(resolved.getRisk()).isEqualTo(RiskParameters.none());
        assertThat(resolved.getEntryFeeRate()).isEqualByComparingTo("0.001");
        assertThat(resolved.getExitFeeRate()).isEqualByComparingTo("0.001");
        assertThat(resolved.getPriceIncrement()).isEqualByComparingTo("0.01");
        assertThat(resolved.getQuantityScale()).isEqualTo(6);
        assertThat(resolved.getMaxOpenPositions()).isEqualTo(1);
    }

    @Test
    @DisplayName("Session values override engine defaults")
    void keepsExplicitValues() {
        SessionConfig resolved = validator.validateAndResolve(valid()
                .entryFeeRate(new BigDecimal("0.0002"))
                .priceIncrement(new BigDecimal("0.5"))
                .maxOpenPositions(4)
                .build());

        assertThat(resolved.getEntryFeeRate()).isEqualByComparingTo("0.0002");
        assertThat(resolved.getPriceIncrement()).isEqualByComparingTo("0.5");
        assertThat(resolved.getMaxOpenPositions()).isEqualTo(4);
    }

    @Test
    @DisplayName("Reports every violated rule at once")
    void collectsAllErrors() {
        SessionConfig config = SessionConfig.builder()
                .symbol("  ")
                .initialCapital(BigDecimal.ZERO)
                .risk(RiskParameters.builder()
                        .stopLossPercent(new BigDecimal("0"))
                        .takeProfitPercent(new BigDecimal("150"))
                        .build())
                .exitFeeRate(new BigDecimal("-0.1"))
                .quantityScale(30)
                .maxOpenPositions(0)
                .build();

        assertThatThrownBy(() -> validator.validateAndResolve(config))
                .isInstanceOfSatisfying(ValidationException.class, e -> assertThat(errorsOf(e)).containsExactly(
                        "symbol must not be blank",
                        "initialCapital must be greater than 0",
                        "stopLossPercent must be in (0, 100]",
                        "takeProfitPercent must be in (0, 100]",
                        "fee rates must not be negative",
                        "quantityScale must be between 0 and 18",
                        "maxOpenPositions must be at least 1"));
    }

    @Test
    @DisplayName("100 percent is the upper bound and is allowed")
    void hundredPercentAllowed() {
        SessionConfig config = valid()
                .risk(RiskParameters.builder().maxPositionSizePercent(new BigDecimal("100")).build())
                .build();

        assertThat(validator.validateAndResolve(config).getRisk().getMaxPositionSizePercent())
                .isEqualByComparingTo("100");
    }

    @Test
    @DisplayName("Backtests need an ordered range")
    void backtestRange() {
        Instant start = Instant.parse("2024-01-02T00:00:00Z");

        assertThatThrownBy(() -> validator.validateAndResolve(valid().mode(SessionMode.BACKTEST).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("backtestStart and backtestEnd are required");
        assertThatThrownBy(() -> validator.validateAndResolve(
                        valid().mode(SessionMode.BACKTEST).backtestStart(start).backtestEnd(start).build()))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("backtestStart must be before backtestEnd");

        assertThat(validator.validateAndResolve(valid()
                        .mode(SessionMode.BACKTEST)
                        .backtestStart(start)
                        .backtestEnd(start.plusSeconds(3600))
                        .build())
                .getMode()).isEqualTo(SessionMode.BACKTEST);
    }

    @Test
    @DisplayName("A missing config is rejected")
    void nullConfig() {
        assertThatThrownBy(() -> validator.validateAndResolve(null)).isInstanceOf(ValidationException.class);
    }
}
