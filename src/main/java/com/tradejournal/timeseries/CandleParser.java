package com.tradejournal.timeseries;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Converts raw candle records into {@link Candle}s sorted by bucket start.
 *
 * <p>Records with a missing or unparseable start time, high or low are skipped one by one;
 * a bad record never discards the rest of the batch.
 */
@Component
public class CandleParser {

    private static final Logger log = LoggerFactory.getLogger(CandleParser.class);

    static final String TIME = "t";
    static final String HIGH = "h";
    static final String LOW = "l";

    public List<Candle> parse(String coin, CandleInterval interval, List<Map<String, Object>> records) {
        if (records == null || records.isEmpty()) {
            return List.of();
        }

        List<Candle> candles = new ArrayList<>(records.size());
        int skipped = 0;
        for (Map<String, Object> record : records) {
            Candle candle = parseRecord(coin, interval, record);
            if (candle == null) {
                skipped++;
            } else {
                candles.add(candle);
            }
        }

        if (skipped > 0) {
            log.warn("{}: skipped {} of {} malformed candle records", coin, skipped, records.size());
        }

        candles.sort(Comparator.comparingLong(Candle::getTimestamp));
        return candles;
    }

    private Candle parseRecord(String coin, CandleInterval interval, Map<String, Object> record) {
        if (record == null) {
            return null;
        }
        BigDecimal time = toDecimal(record.get(TIME));
        BigDecimal high = toDecimal(record.get(HIGH));
        BigDecimal low = toDecimal(record.get(LOW));
        if (time == null || high == null || low == null) {
            return null;
        }
        return Candle.builder()
                .coin(coin)
                .interval(interval)
                .timestamp(time.longValue())
                .high(high)
                .low(low)
                .build();
    }

    private BigDecimal toDecimal(Object value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof Number || value instanceof String) {
            try {
                return new BigDecimal(value.toString().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
