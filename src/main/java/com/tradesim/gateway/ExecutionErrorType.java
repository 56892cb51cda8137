package com.tradesim.gateway;

/**
 * Closed set of failure kinds an {@link ExecutionGateway} may report. Callers decide on retry
 * from this alone; no exchange-specific error code leaks past the gateway.
 */
public enum ExecutionErrorType {

    /** Venue throttled the request. Retryable after {@code retryAfter}. */
    RATE_LIMITED(true),

    INSUFFICIENT_FUNDS(false),

    /** Venue refused the order; the reason is carried on the exception. */
    REJECTED_BY_VENUE(false),

    /** Transport failure before a venue answer was received. Retryable. */
    DISCONNECTED(true),

    UNKNOWN(false);

    private final boolean retryable;

    ExecutionErrorType(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
