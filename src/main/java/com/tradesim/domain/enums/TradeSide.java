package com.tradesim.domain.enums;

/** Aggressor side of a trade, or side of an order sent to a venue. */
public enum TradeSide {
    BUY,
    SELL;

    /** Returns the opposite side: BUY -> SELL, SELL -> BUY. */
    public TradeSide opposite() {
        return this == BUY ? SELL : BUY;
    }
}
