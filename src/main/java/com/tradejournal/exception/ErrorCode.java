package com.tradejournal.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/** Error codes rendered in the {@code error.code} field, each bound to its HTTP status. */
@Getter
public enum ErrorCode {
    BAD_REQUEST(HttpStatus.BAD_REQUEST),
    NOT_FOUND(HttpStatus.NOT_FOUND),
    INTERNAL_ERROR(HttpStatus.INTERNAL_SERVER_ERROR),
    /** The venue was unreachable or answered with an error. */
    VENUE_ERROR(HttpStatus.BAD_GATEWAY);

    private final HttpStatus httpStatus;

    ErrorCode(HttpStatus httpStatus) {
        this.httpStatus = httpStatus;
    }

    public String getCode() {
        return name();
    }
}
