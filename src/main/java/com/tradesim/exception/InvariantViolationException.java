package com.tradesim.exception;

import java.util.Map;

/**
 * A session broke one of its own contracts (capital conservation, state machine). This is a
 * programming error: the affected session is forced to STOPPED and the violation logged with
 * the full state. It never propagates to other sessions.
 */
public class InvariantViolationException extends BaseException {

    public InvariantViolationException(String message, Map<String, Object> details) {
        super(ErrorCode.INVARIANT_VIOLATION, message, details);
    }
}
