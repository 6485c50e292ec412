package com.tradejournal.timeseries;

import java.util.List;
import java.util.Map;

/**
 * Source of raw candle records for excursion enrichment.
 *
 * <p>Records are returned as the source delivers them, one map per candle with at least the
 * bucket start under {@code "t"} and the extremes under {@code "h"} and {@code "l"}. Values may
 * be numbers or numeric strings; {@link CandleParser} handles malformed entries. Implementations
 * may be live, cached or stubbed; callers treat any exception as "no candles".
 */
@FunctionalInterface
public interface CandleFetcher {

    List<Map<String, Object>> fetch(String coin, CandleInterval interval, long startMs, long endMs);
}
