package com.tradesim.exception;

import java.util.Map;

/** The session worker pool has no free slot for another running session. */
public class CapacityExceededException extends BaseException {

    public CapacityExceededException(int maxSessions) {
        super(
                ErrorCode.CAPACITY_EXHAUSTED,
                "No capacity for another running session (max " + maxSessions + ")",
                Map.of("maxSessions", maxSessions));
    }
}
