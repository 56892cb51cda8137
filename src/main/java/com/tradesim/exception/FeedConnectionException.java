package com.tradesim.exception;

/**
 * Transport-level failure of a feed adapter. Retried inside the adapter with backoff and never
 * surfaced beyond the hub: consumers only see a gap in events.
 */
public class FeedConnectionException extends BaseException {

    public FeedConnectionException(String message) {
        super(ErrorCode.FEED_UNAVAILABLE, message);
    }

    public FeedConnectionException(String message, Throwable cause) {
        super(ErrorCode.FEED_UNAVAILABLE, message, cause);
    }
}
