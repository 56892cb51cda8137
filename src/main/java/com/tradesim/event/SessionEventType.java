package com.tradesim.event;

/** Classifies a {@link SessionEvent}. */
public enum SessionEventType {
    SESSION_CREATED,
    STATUS_CHANGED,
    POSITION_OPENED,
    POSITION_CLOSED,

    /** Something the operator should see, such as a rejected live order. */
    ALERT,

    /** Capital conservation failed; the session was forced to STOPPED. */
    INVARIANT_VIOLATION,

    EQUITY_SAMPLE
}
