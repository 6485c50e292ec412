package com.tradejournal.domain.enums;

import java.math.BigDecimal;

/**
 * Buy or sell side of a fill. The side of a trade is the side of the fill that opened it,
 * so BUY means a long round trip and SELL a short one.
 *
 * <p>The venue encodes sides as "B" (bid/buy) and "A" (ask/sell).
 */
public enum Side {
    BUY("B"),
    SELL("A");

    private final String venueCode;

    Side(String venueCode) {
        this.venueCode = venueCode;
    }

    public String getVenueCode() {
        return venueCode;
    }

    public boolean isLong() {
        return this == BUY;
    }

    /** Applies the position sign of this side to an unsigned size: +size for BUY, -size for SELL. */
    public BigDecimal signed(BigDecimal size) {
        return this == BUY ? size : size.negate();
    }

    /**
     * Resolve a side from the venue's single-letter code. Anything other than "B" is a sell,
     * matching how the venue reports ask-side executions.
     */
    public static Side fromVenueCode(String code) {
        return "B".equals(code) ? BUY : SELL;
    }
}
