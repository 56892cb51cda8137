package com.tradesim.domain.enums;

/** Direction of a simulated position. */
public enum PositionSide {
    LONG,
    SHORT;

    /** Multiplier applied to the price move: +1 for long, -1 for short. */
    public int direction() {
        return this == LONG ? 1 : -1;
    }

    /** Order side that opens a position of this direction. */
    public TradeSide entrySide() {
        return this == LONG ? TradeSide.BUY : TradeSide.SELL;
    }

    /** Order side that closes a position of this direction. */
    public TradeSide exitSide() {
        return entrySide().opposite();
    }
}
