package com.tradesim.domain.enums;

/** Why a position was closed. */
public enum ExitReason {
    SIGNAL,
    STOP_LOSS,
    TAKE_PROFIT,
    MANUAL,

    /** Backtest bar sequence exhausted with the position still open. */
    END_OF_DATA
}
