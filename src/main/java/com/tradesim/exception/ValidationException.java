package com.tradesim.exception;

import java.util.Map;

/** Rejected session configuration. Returned synchronously to whoever issued the create command. */
public class ValidationException extends BaseException {

    public ValidationException(String message) {
        super(ErrorCode.VALIDATION_ERROR, message);
    }

    public ValidationException(String message, Map<String, Object> details) {
        super(ErrorCode.VALIDATION_ERROR, message, details);
    }
}
