package com.tradejournal.api.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.tradejournal.exception.ErrorCode;
import java.time.Instant;
import java.util.Map;

/**
 * Error envelope rendered by {@code GlobalExceptionHandler}:
 * {@code {"success": false, "error": {"code", "status", "message", "details", "timestamp", "path"}}}.
 */
public record ApiErrorResponse(boolean success, Error error) {

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Error error = new Error(
                errorCode.getCode(), errorCode.getHttpStatus().value(), message, details, Instant.now(), path);
        return new ApiErrorResponse(false, error);
    }

    public record Error(
            String code,
            int status,
            String message,
            @JsonInclude(JsonInclude.Include.NON_EMPTY) Map<String, Object> details,
            Instant timestamp,
            String path) {}
}
