package com.tradesim.gateway;

import com.tradesim.domain.enums.OrderType;
import com.tradesim.domain.enums.TradeSide;
import java.math.BigDecimal;
import java.util.List;

/**
 * Capability interface for live order execution. The simulation engine's live mode talks to
 * venues only through this interface and never sees an exchange's authentication or transport.
 *
 * <p>New exchanges add an implementation; the engine does not change. Every method reports
 * failure with an {@link ExecutionException} whose {@link ExecutionErrorType} is one of a
 * closed set. Retrying is the caller's job.
 */
public interface ExecutionGateway {

    /** Short venue name used in logs and metrics, e.g. "binance". */
    String venue();

    /**
     * Places an order.
     *
     * @param symbol   venue symbol, e.g. BTCUSDT
     * @param side     BUY or SELL
     * @param quantity base-asset quantity, positive
     * @param type     MARKET or LIMIT
     * @return the venue acknowledgement
     * @throws ExecutionException on any failure
     */
    OrderAck placeOrder(String symbol, TradeSide side, BigDecimal quantity, OrderType type);

    /**
     * Cancels an open order.
     *
     * @throws ExecutionException on any failure
     */
    void cancelOrder(String symbol, String orderId);

    /** @throws ExecutionException on any failure */
    List<Balance> getBalances();

    /** @throws ExecutionException on any failure */
    List<VenuePosition> getPositions();
}
