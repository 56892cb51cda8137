package com.tradesim.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradesim.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Value;

/**
 * Error envelope written by {@code GlobalExceptionHandler}:
 * {@code {"success": false, "error": {"code", "message", "details", "timestamp", "path"}}}.
 * Details are omitted when empty.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiErrorResponse {

    boolean success;
    ErrorBody error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        ErrorBody error = ErrorBody.builder()
                .code(errorCode.getCode())
                .message(message)
                .details(details == null || details.isEmpty() ? null : details)
                .timestamp(Instant.now())
                .path(path)
                .build();
        return new ApiErrorResponse(false, error);
    }

    @Value
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ErrorBody {
        String code;
        String message;
        Map<String, Object> details;
        Instant timestamp;
        String path;
    }
}
