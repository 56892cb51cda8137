package com.tradesim.engine;

import com.tradesim.domain.enums.OrderType;
import com.tradesim.domain.enums.TradeSide;
import com.tradesim.gateway.ExecutionErrorType;
import com.tradesim.gateway.ExecutionException;
import com.tradesim.gateway.ExecutionGateway;
import com.tradesim.gateway.OrderAck;
import io.github.resilience4j.core.IntervalBiFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.math.BigDecimal;
import java.time.Duration;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Routes the orders of LIVE sessions to the configured {@link ExecutionGateway}.
 *
 * <p>Retry policy (resilience4j {@link Retry}, {@code liveOrders}):
 * <ul>
 *   <li>Only RATE_LIMITED and DISCONNECTED are retried, up to {@code max-attempts} calls.</li>
 *   <li>RATE_LIMITED waits for the venue's Retry-After when given.</li>
 *   <li>Everything else doubles from {@code base-backoff-ms}.</li>
 * </ul>
 * Terminal failures propagate to the session, which skips the fill and raises an alert.
 */
@Service
public class LiveOrderRouter {

    private static final Logger log = LoggerFactory.getLogger(LiveOrderRouter.class);

    private final ExecutionGateway gateway;
    private final Retry retry;

    @Autowired
    public LiveOrderRouter(
            ObjectProvider<ExecutionGateway> gatewayProvider,
            @Value("${tradesim.live.max-attempts:3}") int maxAttempts,
            @Value("${tradesim.live.base-backoff-ms:500}") long baseBackoffMs) {
        this(gatewayProvider.getIfAvailable(), maxAttempts, Duration.ofMillis(baseBackoffMs));
    }

    public LiveOrderRouter(ExecutionGateway gateway, int maxAttempts, Duration baseBackoff) {
        this.gateway = gateway;
        RetryConfig config = RetryConfig.<OrderAck>custom()
                .maxAttempts(maxAttempts)
                .intervalBiFunction(retryInterval(baseBackoff))
                .retryOnException(e -> e instanceof ExecutionException ee && ee.isRetryable())
                .build();
        this.retry = Retry.of("liveOrders", config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("Live order attempt {} failed, retrying in {}ms: {}",
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()));
    }

    static IntervalBiFunction<OrderAck> retryInterval(Duration baseBackoff) {
        long baseMs = Math.max(1, baseBackoff.toMillis());
        return (attempt, result) -> {
            if (result.isLeft()
                    && result.getLeft() instanceof ExecutionException ee
                    && ee.getType() == ExecutionErrorType.RATE_LIMITED
                    && ee.getRetryAfter() != null) {
                return ee.getRetryAfter().toMillis();
            }
            return baseMs << Math.min(Math.max(attempt - 1, 0), 10);
        };
    }

    public boolean isAvailable() {
        return gateway != null;
    }

    public Optional<String> venue() {
        return Optional.ofNullable(gateway).map(ExecutionGateway::venue);
    }

    /**
     * Places a MARKET order, retrying transient failures.
     *
     * @throws ExecutionException the terminal failure, or the last retryable one once attempts run out
     */
    public OrderAck route(String symbol, TradeSide side, BigDecimal quantity) {
        if (gateway == null) {
            throw ExecutionException.rejected("No execution gateway configured");
        }
        OrderAck ack = Retry.decorateSupplier(retry, () -> gateway.placeOrder(symbol, side, quantity, OrderType.MARKET))
                .get();
        log.info("Live {} {} {} acknowledged: order {} filled {} @ {}",
                side, quantity, symbol, ack.getOrderId(), ack.getFilledQuantity(), ack.getAverageFillPrice());
        return ack;
    }
}
