package com.tradejournal.timeseries;

import java.math.BigDecimal;
import lombok.Builder;
import lombok.Value;

/**
 * High/low extremes of one candle bucket, as used by excursion enrichment.
 *
 * <p>The {@code timestamp} is the epoch millisecond of the bucket start; the bucket covers
 * {@code [timestamp, timestamp + interval)}.
 */
@Value
@Builder
public class Candle {

    String coin;

    CandleInterval interval;

    /** Epoch millisecond of the candle bucket start. */
    long timestamp;

    /** Highest traded price in this interval. */
    BigDecimal high;

    /** Lowest traded price in this interval. */
    BigDecimal low;

    public long endExclusive() {
        return timestamp + interval.getDurationMs();
    }

    /** True when this bucket shares at least one instant with {@code [from, to]}. */
    public boolean overlaps(long from, long to) {
        return endExclusive() > from && timestamp <= to;
    }
}
