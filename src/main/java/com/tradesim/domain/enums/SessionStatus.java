package com.tradesim.domain.enums;

/**
 * Lifecycle state of a trading session.
 *
 * <pre>
 *   CREATED -> ACTIVE &lt;-> PAUSED -> STOPPED
 * </pre>
 *
 * <p>STOPPED is terminal. Both ACTIVE and PAUSED can move to STOPPED.
 */
public enum SessionStatus {
    CREATED,
    ACTIVE,
    PAUSED,
    STOPPED;

    public boolean isTerminal() {
        return this == STOPPED;
    }
}
