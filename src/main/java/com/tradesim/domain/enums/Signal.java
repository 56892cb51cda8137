package com.tradesim.domain.enums;

/** Output of the strategy signal collaborator. */
public enum Signal {
    BUY,
    SELL,
    NEUTRAL;

    public boolean isNeutral() {
        return this == NEUTRAL;
    }

    /** True when this signal points against a position of the given side. */
    public boolean opposes(PositionSide side) {
        return (side == PositionSide.LONG && this == SELL) || (side == PositionSide.SHORT && this == BUY);
    }
}
