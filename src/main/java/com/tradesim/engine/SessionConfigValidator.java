package com.tradesim.engine;

import com.tradesim.config.EngineConfig;
import com.tradesim.domain.enums.SessionMode;
import com.tradesim.domain.model.RiskParameters;
import com.tradesim.domain.model.SessionConfig;
import com.tradesim.exception.ValidationException;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Checks a session config before a session is created and fills engine defaults into the
 * fields it leaves null. All violations are collected and reported together.
 */
@Component
public class SessionConfigValidator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MAX_QUANTITY_SCALE = 18;
    private static final String DEFAULT_TIMEFRAME = "1m";

    private final EngineConfig engineConfig;

    public SessionConfigValidator(EngineConfig engineConfig) {
        this.engineConfig = engineConfig;
    }

    /**
     * @return the config with every optional numeric setting resolved
     * @throws ValidationException listing every violated rule
     */
    public SessionConfig validateAndResolve(SessionConfig config) {
        if (config == null) {
            throw new ValidationException("Session config is required");
        }
        SessionConfig resolved = resolveDefaults(config);
        List<String> errors = new ArrayList<>();

        if (isBlank(resolved.getSymbol())) {
            errors.add("symbol must not be blank");
        }
        if (isBlank(resolved.getTimeframe())) {
            errors.add("timeframe must not be blank");
        }
        if (resolved.getInitialCapital() == null || resolved.getInitialCapital().signum() <= 0) {
            errors.add("initialCapital must be greater than 0");
        }

        RiskParameters risk = resolved.getRisk();
        checkPercent(risk.getStopLossPercent(), "stopLossPercent", errors);
        checkPercent(risk.getTakeProfitPercent(), "takeProfitPercent", errors);
        checkPercent(risk.getMaxPositionSizePercent(), "maxPositionSizePercent", errors);

        if (resolved.getEntryFeeRate().signum() < 0 || resolved.getExitFeeRate().signum() < 0) {
            errors.add("fee rates must not be negative");
        }
        if (resolved.getPriceIncrement().signum() <= 0) {
            errors.add("priceIncrement must be greater than 0");
        }
        if (resolved.getQuantityScale() < 0 || resolved.getQuantityScale() > MAX_QUANTITY_SCALE) {
            errors.add("quantityScale must be between 0 and " + MAX_QUANTITY_SCALE);
        }
        if (resolved.getMaxOpenPositions() < 1) {
            errors.add("maxOpenPositions must be at least 1");
        }

        if (resolved.getMode() == SessionMode.BACKTEST) {
            if (resolved.getBacktestStart() == null || resolved.getBacktestEnd() == null) {
                errors.add("backtestStart and backtestEnd are required for BACKTEST sessions");
            } else if (!resolved.getBacktestStart().isBefore(resolved.getBacktestEnd())) {
                errors.add("backtestStart must be before backtestEnd");
            }
        }

        if (!errors.isEmpty()) {
            throw new ValidationException(
                    "Invalid session config: " + String.join("; ", errors), Map.of("errors", errors));
        }
        return resolved;
    }

    private SessionConfig resolveDefaults(SessionConfig config) {
        return config.toBuilder()
                .symbol(config.getSymbol() == null ? null : config.getSymbol().trim().toUpperCase(Locale.ROOT))
                .timeframe(orDefault(config.getTimeframe(), DEFAULT_TIMEFRAME))
                .risk(config.getRisk() != null ? config.getRisk() : RiskParameters.none())
                .mode(config.getMode() != null ? config.getMode() : SessionMode.PAPER)
                .entryFeeRate(orDefault(config.getEntryFeeRate(), engineConfig.getEntryFeeRate()))
                .exitFeeRate(orDefault(config.getExitFeeRate(), engineConfig.getExitFeeRate()))
                .priceIncrement(orDefault(config.getPriceIncrement(), engineConfig.getPriceIncrement()))
                .quantityScale(orDefault(config.getQuantityScale(), engineConfig.getQuantityScale()))
                .maxOpenPositions(orDefault(config.getMaxOpenPositions(), engineConfig.getMaxOpenPositions()))
                .build();
    }

    private static void checkPercent(BigDecimal value, String field, List<String> errors) {
        if (value != null && (value.signum() <= 0 || value.compareTo(HUNDRED) > 0)) {
            errors.add(field + " must be in (0, 100]");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static <T> T orDefault(T value, T fallback) {
        return value != null ? value : fallback;
    }
}
