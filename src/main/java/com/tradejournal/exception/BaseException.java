package com.tradejournal.exception;

import java.util.Map;
import lombok.Getter;

/**
 * Root of the application's unchecked exceptions. The error code picks the HTTP status and
 * {@code details} is rendered as {@code error.details} in the response.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;
    private final Map<String, Object> details;

    protected BaseException(ErrorCode errorCode, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Map.copyOf(details);
    }
}
