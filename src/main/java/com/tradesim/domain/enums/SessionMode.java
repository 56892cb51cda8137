package com.tradesim.domain.enums;

/** How a session's fills are produced. */
public enum SessionMode {

    /** Fills simulated against the live feed. */
    PAPER,

    /** Fills simulated against a bounded historical bar sequence. */
    BACKTEST,

    /** Every simulated fill is first sent to a venue through the ExecutionGateway. */
    LIVE
}
