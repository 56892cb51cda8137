package com.tradesim.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INVALID_STATE("INVALID_STATE", 409),
    INVARIANT_VIOLATION("INVARIANT_VIOLATION", 500),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    EXECUTION_ERROR("EXECUTION_ERROR", 502),
    FEED_UNAVAILABLE("FEED_UNAVAILABLE", 503),
    CAPACITY_EXHAUSTED("CAPACITY_EXHAUSTED", 503);

    private final String code;
    private final int httpStatus;
}
