package com.tradesim.domain.enums;

/**
 * Kind of normalized market data event. Each kind maps to one exchange stream per symbol,
 * so a {@code (symbol, kind)} pair identifies exactly one upstream feed.
 */
public enum EventKind {

    /** Individual trade print. */
    TRADE,

    /** Trade aggregated by the exchange at the same price and taker side. */
    AGGREGATED_TRADE,

    /** Perpetual funding rate update, carries the mark price. */
    FUNDING_RATE,

    /** Forced liquidation order. */
    LIQUIDATION,

    /** Close of a completed price bar (kline). */
    BAR_CLOSE
}
