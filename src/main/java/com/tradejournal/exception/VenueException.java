package com.tradejournal.exception;

import java.util.Map;

/** A request to the trading venue failed after retries, or returned an unusable response. */
public class VenueException extends BaseException {

    public VenueException(String message) {
        super(ErrorCode.VENUE_ERROR, message, Map.of(), null);
    }

    public VenueException(String message, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, Map.of(), cause);
    }

    /** @param query the venue query type that failed, e.g. {@code userFillsByTime} */
    public VenueException(String message, String query, Throwable cause) {
        super(ErrorCode.VENUE_ERROR, message, Map.of("query", query), cause);
    }
}
