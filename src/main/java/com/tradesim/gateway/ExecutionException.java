package com.tradesim.gateway;

import com.tradesim.exception.BaseException;
import com.tradesim.exception.ErrorCode;
import java.time.Duration;
import java.util.Map;
import lombok.Getter;

/**
 * Failure of a live order operation. Returned to whatever initiated the order; only
 * {@link ExecutionErrorType#RATE_LIMITED} and {@link ExecutionErrorType#DISCONNECTED} are
 * worth retrying.
 */
@Getter
public class ExecutionException extends BaseException {

    private final ExecutionErrorType type;

    /** Venue-suggested wait before retrying; only set for RATE_LIMITED. */
    private final Duration retryAfter;

    private ExecutionException(ExecutionErrorType type, String message, Duration retryAfter, Throwable cause) {
        super(ErrorCode.EXECUTION_ERROR, message, cause);
        this.type = type;
        this.retryAfter = retryAfter;
    }

    public static ExecutionException rateLimited(Duration retryAfter) {
        return new ExecutionException(
                ExecutionErrorType.RATE_LIMITED, "Rate limited by venue, retry after " + retryAfter, retryAfter, null);
    }

    public static ExecutionException insufficientFunds(String message) {
        return new ExecutionException(ExecutionErrorType.INSUFFICIENT_FUNDS, message, null, null);
    }

    public static ExecutionException rejected(String reason) {
        return new ExecutionException(ExecutionErrorType.REJECTED_BY_VENUE, reason, null, null);
    }

    public static ExecutionException disconnected(String message, Throwable cause) {
        return new ExecutionException(ExecutionErrorType.DISCONNECTED, message, null, cause);
    }

    public static ExecutionException unknown(String message, Throwable cause) {
        return new ExecutionException(ExecutionErrorType.UNKNOWN, message, null, cause);
    }

    public boolean isRetryable() {
        return type.isRetryable();
    }

    @Override
    public Map<String, Object> getDetails() {
        return retryAfter == null
                ? Map.of("type", type.name())
                : Map.of("type", type.name(), "retryAfterMs", retryAfter.toMillis());
    }
}
